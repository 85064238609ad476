package com.tony.franchiseSimulator.model;

/** Tour des séries éliminatoires, dans l'ordre où ils se jouent. */
public enum PlayoffRound {
    DIVISIONAL,
    CHAMPIONSHIP,
    WORLD_SERIES
}
