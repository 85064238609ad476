package com.tony.franchiseSimulator.model;

public enum RosterStatus {
    ACTIVE,
    RESERVE
}
