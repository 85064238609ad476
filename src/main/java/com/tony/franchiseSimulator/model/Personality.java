package com.tony.franchiseSimulator.model;

public enum Personality {
    TEAM_PLAYER,
    PRIMA_DONNA,
    LEADER
}
