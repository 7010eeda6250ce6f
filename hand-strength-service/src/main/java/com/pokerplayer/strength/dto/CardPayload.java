package com.pokerplayer.strength.dto;

import com.pokerplayer.evaluator.Card;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a card: {@code {"rank": "10", "suit": "spades"}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CardPayload {
    private String rank;
    private String suit;

    public static CardPayload from(Card card) {
        return new CardPayload(card.getRank().getSymbol(), card.getSuit().getWireName());
    }

    public Card toCard() {
        return Card.parse(rank, suit);
    }
}
