package com.pokerplayer.strength.service;

import com.pokerplayer.evaluator.Card;
import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.evaluator.HandResult;
import com.pokerplayer.strength.config.ClassifierThresholds;
import com.pokerplayer.strength.config.PreflopThresholds;
import com.pokerplayer.strength.model.BoardTexture;
import com.pokerplayer.strength.model.RankedHand;
import com.pokerplayer.strength.model.StrengthAssessment;
import com.pokerplayer.strength.model.StrengthTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maps hole cards and board into the {@link StrengthTier} that betting logic works from.
 * <p>
 * Before the flop only the two hole cards matter and the tier comes from a fixed
 * precedence of rank and gap predicates. From the flop on the tier follows the best
 * made hand, adjusted for what the board allows.
 */
@Service
public class HandStrengthClassifier {

    private static final Logger log = LoggerFactory.getLogger(HandStrengthClassifier.class);

    private static final int FLOP_SIZE = 3;
    private static final int RIVER_SIZE = 5;
    private static final int ACE = Card.Rank.ACE.getValue();
    private static final int KING = Card.Rank.KING.getValue();
    private static final int QUEEN = Card.Rank.QUEEN.getValue();
    private static final int JACK = Card.Rank.JACK.getValue();
    private static final int TEN = Card.Rank.TEN.getValue();

    private final HybridHandRanker ranker;
    private final ClassifierThresholds thresholds;

    public HandStrengthClassifier(HybridHandRanker ranker, ClassifierThresholds thresholds) {
        this.ranker = ranker;
        this.thresholds = thresholds;
    }

    public StrengthTier classify(List<Card> holeCards, List<Card> communityCards, boolean headsUp) {
        return assess(holeCards, communityCards, headsUp).getTier();
    }

    /**
     * Classify a hand and keep the ranked hand the tier was derived from.
     *
     * @param holeCards      two private cards; any other count is classified {@link StrengthTier#TRASH}
     * @param communityCards zero to five shared cards; fewer than three are treated as pre-flop
     * @param headsUp        whether only two players remain, which loosens the pre-flop limits
     */
    public StrengthAssessment assess(List<Card> holeCards, List<Card> communityCards, boolean headsUp) {
        List<Card> board = communityCards == null ? List.of() : communityCards;
        RankedHand hand = ranker.evaluate(holeCards, board);

        StrengthTier tier;
        if (hand.getResult().isInvalid()) {
            tier = StrengthTier.TRASH;
        } else if (board.size() < FLOP_SIZE) {
            tier = classifyPreflop(holeCards.get(0), holeCards.get(1), thresholds.forTable(headsUp));
        } else {
            tier = classifyPostflop(hand.getResult(), holeCards, board);
        }

        log.debug("Classified {} on {} as {} (headsUp={}, {})", holeCards, board, tier, headsUp,
                hand.getResult().getDescription());
        return new StrengthAssessment(tier, hand);
    }

    StrengthTier classifyPreflop(Card first, Card second, PreflopThresholds limits) {
        int high = Math.max(first.getRankValue(), second.getRankValue());
        int low = Math.min(first.getRankValue(), second.getRankValue());
        boolean pair = high == low;
        boolean suited = first.getSuit() == second.getSuit();
        int gap = high - low;

        if ((pair && high >= limits.getStrongPocketPairMin())
                || (high == ACE && (low == KING || low == QUEEN))) {
            return StrengthTier.STRONG;
        }
        if (pair
                || high >= limits.getDecentHighCardMin()
                || (suited && gap <= limits.getDecentSuitedGapMax())
                || high >= KING
                || low >= TEN) {
            return StrengthTier.DECENT;
        }
        if (suited
                || gap <= limits.getWeakPlayableConnectedGapMax()
                || high >= limits.getWeakPlayableHighCardMin()
                || low >= limits.getWeakPlayableBothMin()) {
            return StrengthTier.WEAK_PLAYABLE;
        }
        if (high >= limits.getMarginalHighCardMin()
                || (suited && gap <= limits.getMarginalSuitedGapMax())
                || gap <= limits.getMarginalGapMax()) {
            return StrengthTier.MARGINAL;
        }
        return StrengthTier.TRASH;
    }

    StrengthTier classifyPostflop(HandResult result, List<Card> holeCards, List<Card> board) {
        BoardTexture texture = BoardTexture.of(board);
        StrengthTier tier = baseTier(result, texture);

        if (isBorderline(result) && (texture.isPaired() || texture.isFlushPossible())) {
            tier = tier.demotedTo(StrengthTier.WEAK_PLAYABLE);
        }
        if (result.getCategory() == HandCategory.HIGH_CARD
                && board.size() < RIVER_SIZE
                && hasLiveDraw(holeCards, board)) {
            tier = StrengthTier.WEAK_PLAYABLE;
        }
        return tier;
    }

    private StrengthTier baseTier(HandResult result, BoardTexture texture) {
        int primary = result.getPrimaryValue();
        return switch (result.getCategory()) {
            case ROYAL_FLUSH, STRAIGHT_FLUSH, FOUR_OF_A_KIND, FULL_HOUSE -> StrengthTier.PREMIUM;
            case FLUSH -> primary >= KING ? StrengthTier.PREMIUM : StrengthTier.STRONG;
            case STRAIGHT -> texture.isFlushPossible() || texture.isPaired()
                    ? StrengthTier.STRONG
                    : StrengthTier.PREMIUM;
            case THREE_OF_A_KIND -> StrengthTier.STRONG;
            case TWO_PAIR -> primary >= JACK ? StrengthTier.STRONG : StrengthTier.DECENT;
            case ONE_PAIR -> {
                if (primary >= KING) {
                    yield StrengthTier.STRONG;
                }
                if (primary >= TEN) {
                    yield StrengthTier.DECENT;
                }
                yield texture.isCoordinated() ? StrengthTier.WEAK_PLAYABLE : StrengthTier.DECENT;
            }
            case HIGH_CARD -> StrengthTier.MARGINAL;
        };
    }

    private static boolean isBorderline(HandResult result) {
        return result.getCategory() == HandCategory.ONE_PAIR
                || (result.getCategory() == HandCategory.TWO_PAIR && result.getPrimaryValue() < JACK);
    }

    /**
     * An overcard, a four-card flush draw or a four-card straight draw, each using a hole card.
     */
    private static boolean hasLiveDraw(List<Card> holeCards, List<Card> board) {
        int boardHigh = board.stream().mapToInt(Card::getRankValue).max().orElse(0);
        for (Card hole : holeCards) {
            if (hole.getRankValue() > boardHigh) {
                return true;
            }
        }

        List<Card> all = new ArrayList<>(holeCards);
        all.addAll(board);

        Map<Card.Suit, Integer> suitCounts = new EnumMap<>(Card.Suit.class);
        all.forEach(card -> suitCounts.merge(card.getSuit(), 1, Integer::sum));
        for (Card hole : holeCards) {
            if (suitCounts.get(hole.getSuit()) >= 4) {
                return true;
            }
        }

        return hasStraightDraw(holeCards, all);
    }

    private static boolean hasStraightDraw(List<Card> holeCards, List<Card> all) {
        TreeSet<Integer> ranks = withLowAce(all);
        TreeSet<Integer> holeRanks = withLowAce(holeCards);
        for (int low = 1; low <= 10; low++) {
            NavigableSet<Integer> window = ranks.subSet(low, true, low + 4, true);
            if (window.size() >= 4 && !holeRanks.subSet(low, true, low + 4, true).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static TreeSet<Integer> withLowAce(List<Card> cards) {
        TreeSet<Integer> ranks = new TreeSet<>();
        for (Card card : cards) {
            ranks.add(card.getRankValue());
            if (card.getRankValue() == ACE) {
                ranks.add(1);
            }
        }
        return ranks;
    }
}
