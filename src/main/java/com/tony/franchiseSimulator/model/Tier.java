package com.tony.franchiseSimulator.model;

import java.util.Optional;

/**
 * Niveaux de compétition, du plus bas au plus haut.
 * L'ordre de déclaration est l'ordre de promotion.
 */
public enum Tier {
    LOW_A,
    HIGH_A,
    DOUBLE_A,
    TRIPLE_A,
    MLB;

    public Optional<Tier> next() {
        Tier[] all = values();
        return ordinal() + 1 < all.length ? Optional.of(all[ordinal() + 1]) : Optional.empty();
    }

    public boolean isAtLeast(Tier other) {
        return compareTo(other) >= 0;
    }
}
