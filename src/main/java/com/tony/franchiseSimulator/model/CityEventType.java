package com.tony.franchiseSimulator.model;

public enum CityEventType {
    CITY_GROWTH,
    ECONOMIC_MILESTONE,
    STADIUM_MOMENT
}
