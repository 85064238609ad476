package com.tony.franchiseSimulator.model.result;

public record CityMetricsUpdate(int population, int medianIncome, double unemploymentRate, int teamPride,
                                int nationalRecognition, double occupancyRate) {}
