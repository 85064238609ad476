package com.tony.franchiseSimulator.model;

import java.util.List;

public enum PlayerType {
    HITTER(List.of(Tool.HIT, Tool.POWER, Tool.SPEED, Tool.ARM, Tool.FIELD),
            List.of(Tool.HIT, Tool.POWER, Tool.SPEED, Tool.FIELD, Tool.ARM)),
    PITCHER(List.of(Tool.STUFF, Tool.CONTROL, Tool.MOVEMENT),
            List.of(Tool.STUFF, Tool.CONTROL, Tool.MOVEMENT));

    private final List<Tool> tools;
    private final List<Tool> trainingOrder;

    PlayerType(List<Tool> tools, List<Tool> trainingOrder) {
        this.tools = tools;
        this.trainingOrder = trainingOrder;
    }

    /** Outils propres à ce type de joueur, dans l'ordre d'affichage. */
    public List<Tool> tools() {
        return tools;
    }

    /** Ordre de parcours de l'entraînement global : départage les égalités (le défensif avant le bras). */
    public List<Tool> trainingOrder() {
        return trainingOrder;
    }
}
