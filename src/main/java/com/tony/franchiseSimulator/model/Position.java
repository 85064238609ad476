package com.tony.franchiseSimulator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Position {
    SP("SP", PlayerType.PITCHER),
    RP("RP", PlayerType.PITCHER),
    C("C", PlayerType.HITTER),
    FIRST_BASE("1B", PlayerType.HITTER),
    SECOND_BASE("2B", PlayerType.HITTER),
    THIRD_BASE("3B", PlayerType.HITTER),
    SS("SS", PlayerType.HITTER),
    LF("LF", PlayerType.HITTER),
    CF("CF", PlayerType.HITTER),
    RF("RF", PlayerType.HITTER),
    // Utilisé uniquement pour exprimer les besoins des équipes IA
    DH("DH", PlayerType.HITTER);

    private final String code;
    private final PlayerType playerType;

    Position(String code, PlayerType playerType) {
        this.code = code;
        this.playerType = playerType;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public PlayerType getPlayerType() {
        return playerType;
    }

    @JsonCreator
    public static Position fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(code) || p.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Position inconnue : " + code));
    }
}
