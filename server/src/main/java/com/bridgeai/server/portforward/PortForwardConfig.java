package com.bridgeai.server.portforward;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PortForwardConfig {
    public int maxRules = 1024;
    public int maxDrivers = 256;

    public void validate() {
        if (maxRules <= 0) {
            throw new IllegalArgumentException("portForward.maxRules must be positive: " + maxRules);
        }
        if (maxDrivers <= 0) {
            throw new IllegalArgumentException("portForward.maxDrivers must be positive: " + maxDrivers);
        }
    }
}
