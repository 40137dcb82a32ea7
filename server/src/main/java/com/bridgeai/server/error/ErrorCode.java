package com.bridgeai.server.error;

public enum ErrorCode {
    NOT_INITIALIZED,
    INVALID_ARGUMENT,
    CAPACITY_EXCEEDED,
    NOT_FOUND,
    IO_ERROR,
    MODEL_CORRUPT,
    WORKER_START_FAILED
}
