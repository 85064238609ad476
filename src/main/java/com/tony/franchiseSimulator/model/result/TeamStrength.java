package com.tony.franchiseSimulator.model.result;

/**
 * Capacité à marquer (attaque) et à empêcher l'adversaire de marquer (défense), sur l'échelle 20-80.
 */
public record TeamStrength(double offense, double defense) {

    public double overall() {
        return (offense + defense) / 2.0;
    }

    public static TeamStrength balanced(double strength) {
        return new TeamStrength(strength, strength);
    }
}
