package com.bridgeai.server.service;

import com.bridgeai.db.ModelSnapshot;
import com.bridgeai.db.ModelSnapshotDao;
import com.bridgeai.db.SqliteInitializer;
import com.bridgeai.server.ai.AiBuffer;
import com.bridgeai.server.ai.BatchPlan;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.Prediction;
import com.bridgeai.server.bridge.BridgeConfig;
import com.bridgeai.server.bridge.BridgeMode;
import com.bridgeai.server.bridge.BridgeStats;
import com.bridgeai.server.bridge.ChipsetType;
import com.bridgeai.server.bridge.DeviceContext;
import com.bridgeai.server.bridge.KernelBridge;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import com.bridgeai.server.portforward.PortForwardTable;
import com.bridgeai.server.util.DataPathResolver;
import com.bridgeai.util.ModelStateCodec;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.List;

/**
 * Application-facing wrapper around one {@link KernelBridge}, its
 * port-forward table and the SQLite snapshot catalogue.
 */
@Service
public class BridgeService {

    private static final Logger logger = LoggerFactory.getLogger(BridgeService.class);

    private final BridgeConfig config;
    private final KernelBridge bridge;
    private final PortForwardTable portForward;
    private final Path dataDir;
    private final Path modelPath;
    private final String dbPath;
    private final ModelSnapshotDao snapshotDao;

    @Autowired
    public BridgeService(BridgeConfig config) {
        this(config, new KernelBridge(config));
    }

    public BridgeService(BridgeConfig config, KernelBridge bridge) {
        this.config = config;
        this.bridge = bridge;
        this.portForward = new PortForwardTable(config.portForward);
        this.dataDir = Paths.get(DataPathResolver.resolveDataDirectory(config));
        this.modelPath = Paths.get(DataPathResolver.resolveModelPath(config));
        this.dbPath = DataPathResolver.resolveDbPath(config);
        this.snapshotDao = new ModelSnapshotDao(dbPath);
    }

    @PostConstruct
    public void init() {
        logger.info("Initializing bridge service (data dir {})", dataDir.toAbsolutePath());
        try {
            Files.createDirectories(dataDir);
            SqliteInitializer.initialize(dbPath);
        } catch (IOException | SQLException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to prepare data directory " + dataDir, e);
        }

        bridge.init();

        if (config.warmStart && config.aiEnabled) {
            if (Files.exists(modelPath)) {
                try {
                    bridge.loadModel(modelPath);
                    logger.info("Warm start from {}", modelPath);
                } catch (BridgeException e) {
                    logger.warn("Warm start from {} failed, keeping fresh model: {}", modelPath, e.getMessage());
                }
            } else {
                logger.info("No saved model at {}, starting cold", modelPath);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!bridge.isInitialized()) {
            return;
        }
        if (config.persistOnShutdown && config.aiEnabled) {
            try {
                bridge.saveModel(modelPath);
            } catch (BridgeException e) {
                logger.error("Failed to persist model on shutdown", e);
            }
        }
        bridge.shutdown();
    }

    public KernelBridge getBridge() {
        return bridge;
    }

    public PortForwardTable getPortForward() {
        return portForward;
    }

    public DeviceContext registerDevice(int deviceId, ChipsetType chipsetType) {
        return bridge.registerDevice(deviceId, chipsetType != null ? chipsetType : config.chipsetType, null, null);
    }

    public void unregisterDevice(int deviceId) {
        bridge.unregisterDevice(bridge.findDevice(deviceId));
    }

    public List<DeviceContext> listDevices() {
        return bridge.listDevices();
    }

    public void enqueue(int deviceId, CommRequest request) {
        bridge.enqueueRequest(bridge.findDevice(deviceId), request);
    }

    public void respond(int deviceId, int payloadSize) {
        bridge.sendResponse(bridge.findDevice(deviceId), payloadSize);
    }

    public Prediction predict(CommRequest request) {
        return ai().processRequest(request);
    }

    public void feedback(CommRequest request, Prediction prediction, int latencyUs, boolean success) {
        bridge.submitFeedback(request, prediction, latencyUs, success);
    }

    public BridgeStats getStats() {
        return bridge.getStats();
    }

    public BridgeMode getMode() {
        return bridge.getMode();
    }

    public void setMode(BridgeMode mode) {
        bridge.setMode(mode);
    }

    public CommRequest optimize(CommRequest request) {
        return ai().optimizeRequest(request);
    }

    public float failureProbability(CommRequest request) {
        return ai().predictFailure(request);
    }

    public BatchPlan batchPlan(List<CommRequest> requests) {
        return ai().predictBatch(requests);
    }

    public Path saveModel() {
        bridge.saveModel(modelPath);
        return modelPath;
    }

    public Path loadModel() {
        bridge.loadModel(modelPath);
        return modelPath;
    }

    public ModelSnapshot saveSnapshot(String name) {
        requireName(name);
        byte[] blob = ai().exportState();
        long historyIndex = ModelStateCodec.historyIndex(blob);
        try {
            snapshotDao.upsert(name, blob, historyIndex);
            logger.info("Saved model snapshot '{}' ({} bytes)", name, blob.length);
            for (ModelSnapshot s : snapshotDao.list()) {
                if (s.getName().equals(name)) {
                    return s;
                }
            }
        } catch (SQLException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to save snapshot " + name, e);
        }
        throw new BridgeException(ErrorCode.IO_ERROR, "Snapshot " + name + " missing after save");
    }

    public void restoreSnapshot(String name) {
        requireName(name);
        byte[] blob;
        try {
            blob = snapshotDao.loadBlob(name)
                    .orElseThrow(() -> new BridgeException(ErrorCode.NOT_FOUND, "Unknown snapshot " + name));
        } catch (SQLException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to read snapshot " + name, e);
        }
        ai().importState(blob);
        logger.info("Restored model snapshot '{}'", name);
    }

    public List<ModelSnapshot> listSnapshots() {
        try {
            return snapshotDao.list();
        } catch (SQLException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to list snapshots", e);
        }
    }

    public void deleteSnapshot(String name) {
        requireName(name);
        boolean removed;
        try {
            removed = snapshotDao.delete(name);
        } catch (SQLException e) {
            throw new BridgeException(ErrorCode.IO_ERROR, "Failed to delete snapshot " + name, e);
        }
        if (!removed) {
            throw new BridgeException(ErrorCode.NOT_FOUND, "Unknown snapshot " + name);
        }
        logger.info("Deleted model snapshot '{}'", name);
    }

    private AiBuffer ai() {
        if (!bridge.isInitialized()) {
            throw BridgeException.notInitialized("Kernel bridge");
        }
        return bridge.getAiBuffer();
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Snapshot name is required");
        }
    }
}
