package com.tony.franchiseSimulator.model;

import java.util.Optional;

/** Axe de travail d'un joueur : un outil précis, ou OVERALL (l'outil le plus en retard). */
public enum TrainingFocus {
    OVERALL(null),
    HIT(Tool.HIT),
    POWER(Tool.POWER),
    SPEED(Tool.SPEED),
    ARM(Tool.ARM),
    FIELD(Tool.FIELD),
    STUFF(Tool.STUFF),
    CONTROL(Tool.CONTROL),
    MOVEMENT(Tool.MOVEMENT);

    private final Tool tool;

    TrainingFocus(Tool tool) {
        this.tool = tool;
    }

    public Optional<Tool> tool() {
        return Optional.ofNullable(tool);
    }

    public static TrainingFocus of(Tool tool) {
        return valueOf(tool.name());
    }
}
