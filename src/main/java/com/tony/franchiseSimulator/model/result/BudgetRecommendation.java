package com.tony.franchiseSimulator.model.result;

public record BudgetRecommendation(String category, double currentSpend, double recommendedSpend, String reasoning) {}
