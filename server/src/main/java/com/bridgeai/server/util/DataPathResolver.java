package com.bridgeai.server.util;

import com.bridgeai.server.bridge.BridgeConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "bridge.data.dir";
    public static final String SNAPSHOT_DB_FILE = "bridge_snapshots.db";

    public static String resolveDataDirectory(BridgeConfig config) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. bridge_data_directory from the config file
        if (config != null && config.dataDirectory != null && !config.dataDirectory.isEmpty()) {
            return config.dataDirectory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(BridgeConfig config) {
        return resolveDataDirectory(config) + File.separator + SNAPSHOT_DB_FILE;
    }

    public static String resolveModelPath(BridgeConfig config) {
        return resolveDataDirectory(config) + File.separator + config.modelFile;
    }
}
