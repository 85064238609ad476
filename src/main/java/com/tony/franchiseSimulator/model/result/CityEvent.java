package com.tony.franchiseSimulator.model.result;

import com.tony.franchiseSimulator.model.CityEventType;

/**
 * Événement narratif de la saison. Les variations de fierté et de notoriété sont indicatives :
 * elles sont déjà comprises dans les nouvelles métriques de la ville.
 */
public record CityEvent(int year, CityEventType type, String title, String description,
                        int prideChange, int recognitionChange, Integer buildingId) {}
