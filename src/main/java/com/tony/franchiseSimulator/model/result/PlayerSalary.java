package com.tony.franchiseSimulator.model.result;

public record PlayerSalary(String playerId, String name, long salary) {}
