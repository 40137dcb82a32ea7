package com.bridgeai.server.bridge;

public enum BridgeMode {
    // no inference, requests are forwarded as-is
    PASSTHROUGH,
    AI_ASSISTED,
    AI_AUTONOMOUS,
    // inference plus feedback recording
    LEARNING
}
