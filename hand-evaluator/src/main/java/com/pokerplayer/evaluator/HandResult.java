package com.pokerplayer.evaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The best hand found for a set of cards, with everything needed to compare it.
 * <p>
 * Results are ordered by category, then primary value, then secondary value,
 * then kickers compared left to right. The description and the cards used do
 * not take part in the ordering, so {@link #compareTo} is not consistent with
 * {@link #equals}.
 */
public final class HandResult implements Comparable<HandResult> {

    public static final String INVALID_HOLE_CARDS = "Invalid hole cards";

    private static final String[] SINGULAR = {
            "", "", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight",
            "Nine", "Ten", "Jack", "Queen", "King", "Ace"
    };

    private static final String[] PLURAL = {
            "", "", "Twos", "Threes", "Fours", "Fives", "Sixes", "Sevens", "Eights",
            "Nines", "Tens", "Jacks", "Queens", "Kings", "Aces"
    };

    private static final HandResult INVALID =
            new HandResult(HandCategory.HIGH_CARD, 0, 0, List.of(), INVALID_HOLE_CARDS, List.of());

    private final HandCategory category;
    private final int primaryValue;
    private final int secondaryValue;
    private final List<Integer> kickers;
    private final String description;
    private final List<Card> cardsUsed;

    public HandResult(HandCategory category, int primaryValue, int secondaryValue,
                      List<Integer> kickers, String description, List<Card> cardsUsed) {
        this.category = Objects.requireNonNull(category, "category");
        this.primaryValue = primaryValue;
        this.secondaryValue = secondaryValue;
        this.kickers = Collections.unmodifiableList(new ArrayList<>(kickers));
        this.description = Objects.requireNonNull(description, "description");
        this.cardsUsed = Collections.unmodifiableList(new ArrayList<>(cardsUsed));
    }

    /**
     * Builds a result whose description is derived from its category and values.
     */
    public static HandResult of(HandCategory category, int primaryValue, int secondaryValue,
                                List<Integer> kickers, List<Card> cardsUsed) {
        return new HandResult(category, primaryValue, secondaryValue, kickers,
                describe(category, primaryValue, secondaryValue), cardsUsed);
    }

    /**
     * Sentinel returned when the hole cards are malformed, so the caller can still act.
     */
    public static HandResult invalidHoleCards() {
        return INVALID;
    }

    public HandCategory getCategory() {
        return category;
    }

    public int getPrimaryValue() {
        return primaryValue;
    }

    public int getSecondaryValue() {
        return secondaryValue;
    }

    public List<Integer> getKickers() {
        return kickers;
    }

    public String getDescription() {
        return description;
    }

    public List<Card> getCardsUsed() {
        return cardsUsed;
    }

    public boolean isInvalid() {
        return this == INVALID;
    }

    @Override
    public int compareTo(HandResult other) {
        int cmp = Integer.compare(category.getRank(), other.category.getRank());
        if (cmp != 0) return cmp;
        cmp = Integer.compare(primaryValue, other.primaryValue);
        if (cmp != 0) return cmp;
        cmp = Integer.compare(secondaryValue, other.secondaryValue);
        if (cmp != 0) return cmp;

        int shared = Math.min(kickers.size(), other.kickers.size());
        for (int i = 0; i < shared; i++) {
            cmp = Integer.compare(kickers.get(i), other.kickers.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(kickers.size(), other.kickers.size());
    }

    /**
     * Human-readable name of a hand, e.g. "Full House, Kings full of Sevens".
     */
    public static String describe(HandCategory category, int primaryValue, int secondaryValue) {
        String name = category.getDisplayName();
        return switch (category) {
            case ROYAL_FLUSH -> name;
            case STRAIGHT_FLUSH, FLUSH, STRAIGHT -> name + ", " + singular(primaryValue) + " high";
            case FOUR_OF_A_KIND, THREE_OF_A_KIND -> name + ", " + plural(primaryValue);
            case FULL_HOUSE -> name + ", " + plural(primaryValue) + " full of " + plural(secondaryValue);
            case TWO_PAIR -> name + ", " + plural(primaryValue) + " and " + plural(secondaryValue);
            case ONE_PAIR -> "Pair of " + plural(primaryValue);
            case HIGH_CARD -> name + ", " + singular(primaryValue);
        };
    }

    private static String singular(int value) {
        return value >= 2 && value <= 14 ? SINGULAR[value] : String.valueOf(value);
    }

    private static String plural(int value) {
        return value >= 2 && value <= 14 ? PLURAL[value] : String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandResult that = (HandResult) o;
        return primaryValue == that.primaryValue
                && secondaryValue == that.secondaryValue
                && category == that.category
                && kickers.equals(that.kickers)
                && description.equals(that.description)
                && cardsUsed.equals(that.cardsUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, primaryValue, secondaryValue, kickers, description, cardsUsed);
    }

    @Override
    public String toString() {
        return String.format("%s (%s, primary=%d, secondary=%d, kickers=%s)",
                description, category, primaryValue, secondaryValue, kickers);
    }
}
