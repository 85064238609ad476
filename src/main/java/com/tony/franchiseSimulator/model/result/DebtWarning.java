package com.tony.franchiseSimulator.model.result;

/**
 * Alerte d'endettement graduée par rapport au seuil de faillite.
 *
 * @param debtPercent dette en % du budget annuel
 */
public record DebtWarning(Level level, String message, double debtPercent) {

    public enum Level {
        NONE,
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }
}
