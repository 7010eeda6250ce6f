package com.pokerplayer.evaluator;

import java.util.ArrayList;
import java.util.List;

/**
 * Short card notation for tests: "As" is the ace of spades, "10h" the ten of hearts.
 */
final class TestCards {

    private TestCards() {
    }

    static Card card(String code) {
        String rank = code.substring(0, code.length() - 1);
        String suit = switch (code.charAt(code.length() - 1)) {
            case 's' -> "spades";
            case 'h' -> "hearts";
            case 'd' -> "diamonds";
            case 'c' -> "clubs";
            default -> throw new IllegalArgumentException("Unknown suit in " + code);
        };
        return Card.parse(rank, suit);
    }

    static List<Card> cards(String... codes) {
        List<Card> result = new ArrayList<>();
        for (String code : codes) {
            result.add(card(code));
        }
        return result;
    }
}
