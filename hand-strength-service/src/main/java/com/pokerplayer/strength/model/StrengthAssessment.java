package com.pokerplayer.strength.model;

import lombok.Value;

/**
 * The tier handed to betting logic together with the hand it was derived from.
 */
@Value
public class StrengthAssessment {
    StrengthTier tier;
    RankedHand hand;
}
