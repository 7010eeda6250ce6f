package com.pokerplayer.evaluator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * A standard 52-card deck dealt from the top.
 * <p>
 * Seed the {@link Random} to get a reproducible deal.
 */
public class Deck {
    private final Deque<Card> cards;

    public Deck(Random random) {
        List<Card> all = new ArrayList<>(52);
        for (Card.Suit suit : Card.Suit.values()) {
            for (Card.Rank rank : Card.Rank.values()) {
                all.add(new Card(rank, suit));
            }
        }
        Collections.shuffle(all, random);
        this.cards = new ArrayDeque<>(all);
    }

    public static Deck shuffled(long seed) {
        return new Deck(new Random(seed));
    }

    /**
     * Take cards that are already known (e.g. a player's hole cards) out of the deck.
     */
    public Deck without(Collection<Card> known) {
        cards.removeAll(known);
        return this;
    }

    public Card deal() {
        if (cards.isEmpty()) {
            throw new IllegalStateException("Deck is empty");
        }
        return cards.pollFirst();
    }

    public List<Card> deal(int count) {
        if (count > cards.size()) {
            throw new IllegalStateException("Cannot deal " + count + " cards from " + cards.size());
        }
        List<Card> dealt = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            dealt.add(cards.pollFirst());
        }
        return dealt;
    }

    public int remaining() {
        return cards.size();
    }
}
