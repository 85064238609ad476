package com.tony.franchiseSimulator.model;

/** Philosophie de draft d'une équipe IA. */
public enum DraftStrategy {
    BEST_AVAILABLE,
    NEED_BASED,
    UPSIDE_SWING,
    SAFE_FLOOR
}
