package com.tony.franchiseSimulator.model;

public enum WorkEthic {
    POOR,
    AVERAGE,
    EXCELLENT
}
