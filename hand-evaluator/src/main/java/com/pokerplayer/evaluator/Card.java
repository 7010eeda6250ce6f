package com.pokerplayer.evaluator;

import java.util.Locale;
import java.util.Objects;

/**
 * Represents a playing card with a rank and suit.
 */
public final class Card {
    private final Rank rank;
    private final Suit suit;

    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parse a card from its wire form, e.g. rank "10" and suit "hearts".
     *
     * @throws InvalidCardException if the rank or suit is not recognised
     */
    public static Card parse(String rank, String suit) {
        return new Card(Rank.fromSymbol(rank), Suit.fromName(suit));
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Numeric rank, 2 through 14 with the ace high.
     */
    public int getRankValue() {
        return rank.getValue();
    }

    public boolean isBroadway() {
        return rank.getValue() >= Rank.TEN.getValue();
    }

    @Override
    public String toString() {
        return rank.getSymbol() + suit.getSymbol();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }

    public enum Rank {
        TWO(2, "2"),
        THREE(3, "3"),
        FOUR(4, "4"),
        FIVE(5, "5"),
        SIX(6, "6"),
        SEVEN(7, "7"),
        EIGHT(8, "8"),
        NINE(9, "9"),
        TEN(10, "10"),
        JACK(11, "J"),
        QUEEN(12, "Q"),
        KING(13, "K"),
        ACE(14, "A");

        private final int value;
        private final String symbol;

        Rank(int value, String symbol) {
            this.value = value;
            this.symbol = symbol;
        }

        public int getValue() {
            return value;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Rank fromSymbol(String symbol) {
            if (symbol != null) {
                String normalized = symbol.trim().toUpperCase(Locale.ROOT);
                for (Rank rank : values()) {
                    if (rank.symbol.equals(normalized)) {
                        return rank;
                    }
                }
            }
            throw new InvalidCardException("Invalid rank: " + symbol);
        }
    }

    public enum Suit {
        CLUBS("clubs", "♣"),
        DIAMONDS("diamonds", "♦"),
        HEARTS("hearts", "♥"),
        SPADES("spades", "♠");

        private final String wireName;
        private final String symbol;

        Suit(String wireName, String symbol) {
            this.wireName = wireName;
            this.symbol = symbol;
        }

        public String getWireName() {
            return wireName;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Suit fromName(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (Suit suit : values()) {
                    if (suit.wireName.equals(normalized)) {
                        return suit;
                    }
                }
            }
            throw new InvalidCardException("Invalid suit: " + name);
        }
    }
}
