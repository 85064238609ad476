package com.tony.franchiseSimulator.model;

public enum FreeAgentOutcome {
    RESIGNED,
    DEPARTED
}
