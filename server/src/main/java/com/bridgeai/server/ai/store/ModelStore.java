package com.bridgeai.server.ai.store;

import com.bridgeai.server.ai.ModelState;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import com.bridgeai.util.ModelStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Whole-model snapshot files. A missing or unreadable file is {@code IO_ERROR};
 * a file that reads fine but has the wrong length is {@code MODEL_CORRUPT}.
 */
public class ModelStore {
    private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);

    public void save(Path path, ModelState state) {
        if (path == null || state == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Model path and state are required");
        }
        byte[] blob = ModelStateCodec.toBytes(state);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // written beside the target, then moved into place
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.write(tmp, blob);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to write model to " + path, e);
        }
        logger.info("Saved model ({} bytes) to {}", blob.length, path);
    }

    public ModelState load(Path path) {
        if (path == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Model path is required");
        }
        byte[] blob;
        try {
            blob = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Model file not found: " + path, e);
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to read model from " + path, e);
        }
        ModelState state = ModelStateCodec.fromBytes(blob);
        logger.info("Loaded model ({} bytes, historyIndex={}) from {}", blob.length,
                state.getHistory().getIndex(), path);
        return state;
    }
}
