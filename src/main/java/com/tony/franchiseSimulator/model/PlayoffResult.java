package com.tony.franchiseSimulator.model;

/** Parcours en séries tel qu'il est archivé dans l'historique de la franchise. */
public enum PlayoffResult {
    CHAMPION,
    FINALS,
    SEMIFINALS,
    MISSED
}
