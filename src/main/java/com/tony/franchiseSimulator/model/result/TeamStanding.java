package com.tony.franchiseSimulator.model.result;

public record TeamStanding(String teamId, String teamName, int wins, int losses, double winPct, double strength) {}
