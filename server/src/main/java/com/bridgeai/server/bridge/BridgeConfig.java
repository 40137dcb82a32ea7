package com.bridgeai.server.bridge;

import com.bridgeai.server.portforward.PortForwardConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bridge settings, bound from {@code /bridge_config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeConfig {
    public static final String RESOURCE = "/bridge_config.json";

    public BridgeMode mode = BridgeMode.AI_AUTONOMOUS;
    public boolean aiEnabled = true;
    public int maxPendingRequests = 1024;
    public long batchTimeoutMs = 10;
    public int maxDevices = 256;
    public ChipsetType chipsetType = ChipsetType.UNKNOWN;
    public String modelFile = "bridge_model.bin";
    public boolean warmStart = false;
    public boolean persistOnShutdown = false;

    @JsonProperty("bridge_data_directory")
    public String dataDirectory;

    public PortForwardConfig portForward = new PortForwardConfig();

    public static BridgeConfig defaults() {
        return new BridgeConfig();
    }

    /**
     * Reads the classpath config, falling back to defaults when the resource is
     * absent.
     */
    public static BridgeConfig load(ObjectMapper mapper) throws IOException {
        try (InputStream is = BridgeConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                return defaults();
            }
            return mapper.readValue(is, BridgeConfig.class);
        }
    }

    public void validate() {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (maxPendingRequests <= 0) {
            throw new IllegalArgumentException("maxPendingRequests must be positive: " + maxPendingRequests);
        }
        if (batchTimeoutMs <= 0) {
            throw new IllegalArgumentException("batchTimeoutMs must be positive: " + batchTimeoutMs);
        }
        if (maxDevices <= 0) {
            throw new IllegalArgumentException("maxDevices must be positive: " + maxDevices);
        }
        if (portForward == null) {
            portForward = new PortForwardConfig();
        }
        portForward.validate();
    }
}
