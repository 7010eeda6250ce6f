package com.pokerplayer.strength.config;

import lombok.Value;

/**
 * Immutable classifier limits for full-ring and heads-up play, fixed at startup.
 */
@Value
public class ClassifierThresholds {
    PreflopThresholds regular;
    PreflopThresholds headsUp;

    public ClassifierThresholds(PreflopThresholds regular, PreflopThresholds headsUp) {
        if (!headsUp.isAtLeastAsWideAs(regular)) {
            throw new IllegalArgumentException("Heads-up thresholds must be at least as wide as regular ones: "
                    + headsUp + " vs " + regular);
        }
        this.regular = regular;
        this.headsUp = headsUp;
    }

    public static ClassifierThresholds defaults() {
        return new StrengthProperties().toThresholds();
    }

    public PreflopThresholds forTable(boolean isHeadsUp) {
        return isHeadsUp ? headsUp : regular;
    }
}
