package com.tony.franchiseSimulator.model.result;

public record PlayerInjury(String playerId, String playerName, int gamesLost) {}
