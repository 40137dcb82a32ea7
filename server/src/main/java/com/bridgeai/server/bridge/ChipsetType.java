package com.bridgeai.server.bridge;

public enum ChipsetType {
    INTEL,
    AMD,
    NVIDIA,
    QUALCOMM,
    UNKNOWN
}
