package com.tony.franchiseSimulator.model;

/**
 * État de la partie. PROMOTED et CHAMPION sont informatifs : seuls ACTIVE et GAME_OVER
 * décrivent un état durable.
 */
public enum GameStatus {
    ACTIVE,
    GAME_OVER,
    PROMOTED,
    CHAMPION
}
