package com.tony.franchiseSimulator.model.result;

public record WinterDevelopment(int ratingChange, String reason) {}
