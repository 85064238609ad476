package com.tony.franchiseSimulator.model.result;

public record DraftOrderEntry(int pickNumber, String teamId, String teamName, int previousSeasonWins,
                              int previousSeasonLosses, double winPct, int draftYear) {}
