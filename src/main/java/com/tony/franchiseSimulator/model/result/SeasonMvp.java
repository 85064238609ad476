package com.tony.franchiseSimulator.model.result;

public record SeasonMvp(String playerId, String playerName, double score) {}
