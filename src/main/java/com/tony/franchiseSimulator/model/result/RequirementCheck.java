package com.tony.franchiseSimulator.model.result;

public record RequirementCheck(String criterion, double required, double actual, boolean met) {}
