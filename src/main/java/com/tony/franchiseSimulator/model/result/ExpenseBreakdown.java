package com.tony.franchiseSimulator.model.result;

public record ExpenseBreakdown(long playerSalaries, long coachingSalaries, long stadiumMaintenance, long travel,
                               long marketing, long debtService, long total) {}
