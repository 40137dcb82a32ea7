package com.bridgeai.server.bridge;

public enum WorkerState {
    IDLE,
    WAITING,
    DRAINING,
    STOPPED
}
