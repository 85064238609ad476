package com.tony.franchiseSimulator.model.result;

public record RevenueBreakdown(long tickets, long concessions, long parking, long merchandise, long sponsorships,
                               long total) {}
