package com.bridgeai.server.util;

import com.bridgeai.server.bridge.BridgeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

public class DataPathResolverTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(DataPathResolver.DATA_DIR_PROPERTY);
    }

    @Test
    public void testSystemPropertyWins() {
        BridgeConfig config = BridgeConfig.defaults();
        config.dataDirectory = "/from/config";
        System.setProperty(DataPathResolver.DATA_DIR_PROPERTY, "/from/property");
        assertEquals("/from/property", DataPathResolver.resolveDataDirectory(config));
    }

    @Test
    public void testConfigThenDefault() {
        BridgeConfig config = BridgeConfig.defaults();
        assertEquals(".", DataPathResolver.resolveDataDirectory(config));

        config.dataDirectory = "/var/bridge";
        assertEquals("/var/bridge", DataPathResolver.resolveDataDirectory(config));
        assertEquals("/var/bridge" + File.separator + "bridge_model.bin", DataPathResolver.resolveModelPath(config));
        assertEquals("/var/bridge" + File.separator + DataPathResolver.SNAPSHOT_DB_FILE,
                DataPathResolver.resolveDbPath(config));
    }
}
