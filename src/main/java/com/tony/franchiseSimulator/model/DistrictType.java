package com.tony.franchiseSimulator.model;

public enum DistrictType {
    ENTERTAINMENT,
    COMMERCIAL,
    PERFORMANCE
}
