package com.tony.franchiseSimulator.model;

/**
 * Niveau de risque de faillite, ordonné du plus sain au plus grave.
 * {@code BANKRUPT} n'est posé que par le diagnostic de solvabilité, une fois la ligne de fin de partie franchie.
 */
public enum BankruptcyRisk {
    NONE,
    WARNING,
    CRITICAL,
    IMMINENT,
    BANKRUPT
}
