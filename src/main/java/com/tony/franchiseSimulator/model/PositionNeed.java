package com.tony.franchiseSimulator.model;

/** Besoin positionnel d'une équipe IA ; priorité 0-100. */
public record PositionNeed(Position position, int priority) {}
