package com.pokerplayer.strength.oracle;

import com.pokerplayer.evaluator.Card;
import com.pokerplayer.evaluator.HandCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A validated ranking returned by the oracle, with its rank code already mapped to a category.
 */
@Value
@Builder
public class OracleResult {
    HandCategory category;
    int rankCode;
    int value;
    int secondValue;
    @Singular
    List<Integer> kickers;
    @Singular("cardUsed")
    List<Card> cardsUsed;
    @Singular
    List<Card> cards;
}
