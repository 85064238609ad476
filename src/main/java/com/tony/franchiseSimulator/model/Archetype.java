package com.tony.franchiseSimulator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** Étiquette lisible résumant le profil d'outils d'un joueur. */
public enum Archetype {
    SLUGGER("Slugger", Tool.POWER),
    SPEEDSTER("Speedster", Tool.SPEED),
    CONTACT_KING("Contact King", Tool.HIT),
    GLOVE_WIZARD("Glove Wizard", Tool.FIELD),
    CANNON_ARM("Cannon Arm", Tool.ARM),
    FLAMETHROWER("Flamethrower", Tool.STUFF),
    COMMAND_ACE("Command Ace", Tool.CONTROL),
    MOVEMENT_MASTER("Movement Master", Tool.MOVEMENT),
    PLAYMAKER("Playmaker", null),
    RAW_TALENT("Raw Talent", null);

    private final String label;
    private final Tool dominantTool;

    Archetype(String label, Tool dominantTool) {
        this.label = label;
        this.dominantTool = dominantTool;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<Archetype> forDominantTool(Tool tool) {
        return Arrays.stream(values()).filter(a -> a.dominantTool == tool).findFirst();
    }
}
