package com.tony.franchiseSimulator.model;

import java.util.Arrays;
import java.util.Optional;

/** Niveau de précision d'un rapport de scouting. */
public enum ScoutingAccuracy {
    LOW,
    MEDIUM,
    HIGH;

    /** Lecture tolérante d'un code venant de l'extérieur ("low", "Medium"...). Vide si inconnu. */
    public static Optional<ScoutingAccuracy> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(a -> a.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
