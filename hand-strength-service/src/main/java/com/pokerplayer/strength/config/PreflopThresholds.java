package com.pokerplayer.strength.config;

import lombok.Builder;
import lombok.Value;

/**
 * Rank and gap limits for the pre-flop tier predicates.
 */
@Value
@Builder(toBuilder = true)
public class PreflopThresholds {
    int strongPocketPairMin;
    int decentHighCardMin;
    int decentSuitedGapMax;
    int weakPlayableConnectedGapMax;
    int weakPlayableHighCardMin;
    int weakPlayableBothMin;
    int marginalHighCardMin;
    int marginalSuitedGapMax;
    int marginalGapMax;

    /**
     * True when every predicate built from these limits accepts at least the hands {@code other} accepts.
     */
    public boolean isAtLeastAsWideAs(PreflopThresholds other) {
        return strongPocketPairMin <= other.strongPocketPairMin
                && decentHighCardMin <= other.decentHighCardMin
                && decentSuitedGapMax >= other.decentSuitedGapMax
                && weakPlayableConnectedGapMax >= other.weakPlayableConnectedGapMax
                && weakPlayableHighCardMin <= other.weakPlayableHighCardMin
                && weakPlayableBothMin <= other.weakPlayableBothMin
                && marginalHighCardMin <= other.marginalHighCardMin
                && marginalSuitedGapMax >= other.marginalSuitedGapMax
                && marginalGapMax >= other.marginalGapMax;
    }
}
