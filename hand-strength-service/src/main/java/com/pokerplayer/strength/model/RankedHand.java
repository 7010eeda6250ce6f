package com.pokerplayer.strength.model;

import com.pokerplayer.evaluator.HandResult;
import lombok.Value;

/**
 * A hand result tagged with the evaluator that produced it.
 */
@Value
public class RankedHand {
    HandResult result;
    EvaluationSource source;

    public static RankedHand local(HandResult result) {
        return new RankedHand(result, EvaluationSource.LOCAL);
    }

    public static RankedHand oracle(HandResult result) {
        return new RankedHand(result, EvaluationSource.ORACLE);
    }
}
