package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.BuildingType;

/**
 * Passage d'un bâtiment à l'état suivant.
 *
 * @param newName renseigné à l'ouverture (1 -> 2)
 * @param newType renseigné au début des travaux (0 -> 1)
 */
public record BuildingUpgrade(int buildingId, int previousState, int newState, String newName, BuildingType newType) {}
