package com.tony.franchiseSimulator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Emplacement de la ville. État : 0 terrain vague, 1 en construction, 2 ouvert, 3 prospère, 4 emblématique.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Building {
    public static final int OPEN_STATE = 2;
    public static final int MAX_STATE = 4;

    private int id;
    private BuildingType type;
    private int state;
    private String name;
    private Integer yearOpened;

    public boolean isOpen() {
        return type != null && state >= OPEN_STATE;
    }
}
