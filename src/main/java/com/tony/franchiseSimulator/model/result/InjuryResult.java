package com.tony.franchiseSimulator.model.result;

public record InjuryResult(boolean injured, int gamesLost) {

    public static InjuryResult healthy() {
        return new InjuryResult(false, 0);
    }
}
