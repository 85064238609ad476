package com.tony.franchiseSimulator.model.result;

public record SeasonRecord(int wins, int losses, double winPct) {}
