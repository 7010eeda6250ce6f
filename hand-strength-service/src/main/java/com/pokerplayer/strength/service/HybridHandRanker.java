package com.pokerplayer.strength.service;

import com.pokerplayer.evaluator.Card;
import com.pokerplayer.evaluator.CombinationEvaluator;
import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.evaluator.HandResult;
import com.pokerplayer.strength.model.RankedHand;
import com.pokerplayer.strength.oracle.OracleResult;
import com.pokerplayer.strength.oracle.OracleUnavailableException;
import com.pokerplayer.strength.oracle.RankOracleClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Ranks a player's hand, asking the oracle first and falling back to local evaluation.
 * <p>
 * Local evaluation is always sufficient on its own; the oracle is only consulted when
 * it is enabled and at least five cards are known.
 */
@Service
public class HybridHandRanker {

    private static final Logger log = LoggerFactory.getLogger(HybridHandRanker.class);

    private static final Comparator<Card> BY_RANK_DESCENDING =
            Comparator.comparingInt(Card::getRankValue).reversed()
                    .thenComparing(Card::getSuit);

    private final CombinationEvaluator evaluator;
    private final RankOracleClient oracleClient;

    public HybridHandRanker(CombinationEvaluator evaluator, RankOracleClient oracleClient) {
        this.evaluator = evaluator;
        this.oracleClient = oracleClient;
    }

    /**
     * Evaluate the best hand from hole cards and community cards.
     *
     * @param holeCards      the player's two private cards; any other count yields the invalid sentinel
     * @param communityCards zero to five shared cards
     */
    public RankedHand evaluate(List<Card> holeCards, List<Card> communityCards) {
        if (holeCards == null || holeCards.size() != 2) {
            return RankedHand.local(HandResult.invalidHoleCards());
        }
        List<Card> board = communityCards == null ? List.of() : communityCards;
        if (board.size() > 5) {
            throw new IllegalArgumentException("At most 5 community cards, got " + board.size());
        }

        List<Card> allCards = new ArrayList<>(holeCards);
        allCards.addAll(board);
        if (new HashSet<>(allCards).size() != allCards.size()) {
            throw new IllegalArgumentException("Duplicate card in " + allCards);
        }

        if (allCards.size() >= CombinationEvaluator.HAND_SIZE && oracleClient.isEnabled()) {
            try {
                return RankedHand.oracle(toHandResult(oracleClient.rank(allCards)));
            } catch (OracleUnavailableException e) {
                log.warn("Rank oracle unavailable, evaluating locally: {}", e.getMessage());
            }
        }

        log.debug("Evaluating {} cards locally", allCards.size());
        return RankedHand.local(evaluator.evaluate(allCards));
    }

    /**
     * Translate an oracle ranking into the local result shape, rebuilding the kickers
     * from the cards the oracle says it used.
     */
    HandResult toHandResult(OracleResult oracle) {
        HandCategory category = oracle.getCategory();
        int primary = oracle.getValue();
        int secondary = oracle.getSecondValue();

        List<Card> used = new ArrayList<>(oracle.getCardsUsed());
        used.sort(BY_RANK_DESCENDING);

        List<Integer> kickers;
        if (used.size() == CombinationEvaluator.HAND_SIZE) {
            List<Integer> ranks = new ArrayList<>();
            used.forEach(card -> ranks.add(card.getRankValue()));
            kickers = kickersFrom(category, primary, secondary, ranks);
        } else {
            kickers = new ArrayList<>(oracle.getKickers());
            kickers.sort(Comparator.reverseOrder());
        }

        return HandResult.of(category, primary, secondary, kickers, used);
    }

    /**
     * The ranks left over once the cards that define the category are removed, highest first.
     */
    private static List<Integer> kickersFrom(HandCategory category, int primary, int secondary,
                                             List<Integer> ranksDescending) {
        List<Integer> rest = new ArrayList<>(ranksDescending);
        switch (category) {
            case ROYAL_FLUSH, STRAIGHT_FLUSH, STRAIGHT, FULL_HOUSE -> rest.clear();
            case FLUSH, HIGH_CARD -> rest.remove(Integer.valueOf(primary));
            case TWO_PAIR -> rest.removeIf(rank -> rank == primary || rank == secondary);
            default -> rest.removeIf(rank -> rank == primary);
        }
        return rest;
    }
}
