package com.tony.franchiseSimulator.model;

/**
 * Outils (attributs) d'un joueur. Les 5 premiers sont ceux des frappeurs, les 3 derniers ceux des lanceurs.
 */
public enum Tool {
    HIT,
    POWER,
    SPEED,
    ARM,
    FIELD,
    STUFF,
    CONTROL,
    MOVEMENT;

    public boolean belongsTo(PlayerType type) {
        return type.tools().contains(this);
    }
}
