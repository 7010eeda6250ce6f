package com.pokerplayer.strength.model;

import com.pokerplayer.evaluator.Card;
import lombok.Value;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * What the community cards alone make possible.
 */
@Value
public class BoardTexture {

    private static final BoardTexture EMPTY = new BoardTexture(false, false, false);

    /**
     * Two or more board cards share a rank
     */
    boolean paired;

    /**
     * Three or more board cards share a suit
     */
    boolean flushPossible;

    /**
     * Two distinct board ranks lie within two of each other
     */
    boolean coordinated;

    public static BoardTexture of(List<Card> communityCards) {
        if (communityCards == null || communityCards.size() < 3) {
            return EMPTY;
        }

        Map<Integer, Integer> rankCounts = new HashMap<>();
        Map<Card.Suit, Integer> suitCounts = new EnumMap<>(Card.Suit.class);
        for (Card card : communityCards) {
            rankCounts.merge(card.getRankValue(), 1, Integer::sum);
            suitCounts.merge(card.getSuit(), 1, Integer::sum);
        }

        boolean paired = rankCounts.values().stream().anyMatch(c -> c >= 2);
        boolean flushPossible = suitCounts.values().stream().anyMatch(c -> c >= 3);

        TreeSet<Integer> ranks = new TreeSet<>(rankCounts.keySet());
        return new BoardTexture(paired, flushPossible, isCoordinated(ranks));
    }

    private static boolean isCoordinated(TreeSet<Integer> distinctRanks) {
        Integer previous = null;
        for (Integer rank : distinctRanks) {
            if (previous != null && rank - previous <= 2) {
                return true;
            }
            previous = rank;
        }
        return false;
    }
}
