package com.pokerplayer.evaluator;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finds the best five-card poker hand in a set of two to seven cards.
 * <p>
 * Every five-card subset is scored and the highest under {@link HandResult}'s
 * ordering wins. Input order never affects the result: cards are put into a
 * canonical order before the subsets are enumerated.
 */
public class CombinationEvaluator {

    public static final int HAND_SIZE = 5;
    public static final int MAX_CARDS = 7;

    private static final Comparator<Card> CANONICAL_ORDER =
            Comparator.comparingInt(Card::getRankValue).reversed()
                    .thenComparing(Card::getSuit);

    /**
     * Evaluate the best hand available in the given cards.
     *
     * @param cards 2 to 7 distinct cards; 0 or 1 card yields the "Invalid hole cards" sentinel
     * @return the best hand, or a starting-hand descriptor when only two cards are known
     */
    public HandResult evaluate(List<Card> cards) {
        if (cards == null || cards.size() < 2) {
            return HandResult.invalidHoleCards();
        }
        if (cards.size() > MAX_CARDS) {
            throw new IllegalArgumentException("At most " + MAX_CARDS + " cards can be evaluated, got " + cards.size());
        }
        if (new HashSet<>(cards).size() != cards.size()) {
            throw new IllegalArgumentException("Duplicate card in " + cards);
        }

        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(CANONICAL_ORDER);

        if (sorted.size() == 2) {
            return describeStartingHand(sorted.get(0), sorted.get(1));
        }
        if (sorted.size() < HAND_SIZE) {
            return scoreSubset(sorted);
        }

        HandResult best = null;
        for (List<Card> combo : generateCombinations(sorted, HAND_SIZE)) {
            HandResult candidate = scoreSubset(combo);
            if (best == null || candidate.compareTo(best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Describe two hole cards before any community card is dealt.
     */
    private HandResult describeStartingHand(Card high, Card low) {
        List<Card> used = List.of(high, low);
        if (high.getRank() == low.getRank()) {
            return new HandResult(HandCategory.HIGH_CARD, high.getRankValue(), low.getRankValue(),
                    List.of(), "Pocket " + high.getRank().getSymbol() + "s", used);
        }

        String label = (high.getSuit() == low.getSuit() ? "Suited " : "Offsuit ")
                + high.getRank().getSymbol() + low.getRank().getSymbol();
        return new HandResult(HandCategory.HIGH_CARD, high.getRankValue(), 0,
                List.of(low.getRankValue()), label, used);
    }

    /**
     * Score up to five cards already in canonical order. Straights and flushes
     * need all five cards; smaller sets are scored on rank groups alone.
     */
    private HandResult scoreSubset(List<Card> cards) {
        List<RankGroup> groups = groupByRank(cards);
        List<Integer> singles = groups.stream()
                .filter(g -> g.count == 1)
                .map(g -> g.rank)
                .collect(Collectors.toList());

        boolean flush = cards.size() == HAND_SIZE && isFlush(cards);
        int straightHigh = cards.size() == HAND_SIZE ? straightHighCard(groups) : 0;

        if (flush && straightHigh > 0) {
            HandCategory category = straightHigh == Card.Rank.ACE.getValue()
                    ? HandCategory.ROYAL_FLUSH
                    : HandCategory.STRAIGHT_FLUSH;
            return HandResult.of(category, straightHigh, 0, List.of(), cards);
        }

        RankGroup first = groups.get(0);
        RankGroup second = groups.size() > 1 ? groups.get(1) : null;

        if (first.count == 4) {
            return HandResult.of(HandCategory.FOUR_OF_A_KIND, first.rank, 0, singles, cards);
        }
        if (first.count == 3 && second != null && second.count >= 2) {
            return HandResult.of(HandCategory.FULL_HOUSE, first.rank, second.rank, List.of(), cards);
        }
        if (flush) {
            return HandResult.of(HandCategory.FLUSH, singles.get(0), 0, singles.subList(1, singles.size()), cards);
        }
        if (straightHigh > 0) {
            return HandResult.of(HandCategory.STRAIGHT, straightHigh, 0, List.of(), cards);
        }
        if (first.count == 3) {
            return HandResult.of(HandCategory.THREE_OF_A_KIND, first.rank, 0, singles, cards);
        }
        if (first.count == 2 && second != null && second.count == 2) {
            return HandResult.of(HandCategory.TWO_PAIR, first.rank, second.rank, singles, cards);
        }
        if (first.count == 2) {
            return HandResult.of(HandCategory.ONE_PAIR, first.rank, 0, singles, cards);
        }
        return HandResult.of(HandCategory.HIGH_CARD, singles.get(0), 0, singles.subList(1, singles.size()), cards);
    }

    /**
     * Group cards by rank, largest group first and higher rank first within equal sizes.
     */
    private List<RankGroup> groupByRank(List<Card> cards) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (Card card : cards) {
            counts.merge(card.getRankValue(), 1, Integer::sum);
        }

        List<RankGroup> groups = new ArrayList<>();
        counts.forEach((rank, count) -> groups.add(new RankGroup(rank, count)));
        groups.sort(Comparator.comparingInt((RankGroup g) -> g.count).reversed()
                .thenComparing(Comparator.comparingInt((RankGroup g) -> g.rank).reversed()));
        return groups;
    }

    private boolean isFlush(List<Card> cards) {
        Card.Suit suit = cards.get(0).getSuit();
        return cards.stream().allMatch(c -> c.getSuit() == suit);
    }

    /**
     * High card of a five-card straight, 5 for the wheel, or 0 when the ranks do not run.
     */
    private int straightHighCard(List<RankGroup> groups) {
        if (groups.size() != HAND_SIZE) {
            return 0;
        }

        List<Integer> ranks = groups.stream()
                .map(g -> g.rank)
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());

        if (ranks.get(0) - ranks.get(4) == 4) {
            return ranks.get(0);
        }
        if (ranks.equals(List.of(14, 5, 4, 3, 2))) {
            return 5;
        }
        return 0;
    }

    /**
     * Generate all combinations of specified length, preserving input order.
     */
    static List<List<Card>> generateCombinations(List<Card> cards, int length) {
        List<List<Card>> result = new ArrayList<>();
        generateCombinationsHelper(cards, length, 0, new ArrayList<>(), result);
        return result;
    }

    private static void generateCombinationsHelper(List<Card> cards, int length, int start,
                                                   List<Card> current, List<List<Card>> result) {
        if (current.size() == length) {
            result.add(new ArrayList<>(current));
            return;
        }

        for (int i = start; i < cards.size(); i++) {
            current.add(cards.get(i));
            generateCombinationsHelper(cards, length, i + 1, current, result);
            current.remove(current.size() - 1);
        }
    }

    private static final class RankGroup {
        final int rank;
        final int count;

        RankGroup(int rank, int count) {
            this.rank = rank;
            this.count = count;
        }
    }
}
