package com.pokerplayer.evaluator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandResultTest {

    @Test
    void testCategoryDominatesValues() {
        HandResult lowStraight = HandResult.of(HandCategory.STRAIGHT, 5, 0, List.of(), List.of());
        HandResult aceTrips = HandResult.of(HandCategory.THREE_OF_A_KIND, 14, 0, List.of(13, 12), List.of());
        assertTrue(lowStraight.compareTo(aceTrips) > 0);
    }

    @Test
    void testSecondaryBreaksTieBeforeKickers() {
        HandResult acesUpOverNines = HandResult.of(HandCategory.TWO_PAIR, 14, 9, List.of(2), List.of());
        HandResult acesUpOverEights = HandResult.of(HandCategory.TWO_PAIR, 14, 8, List.of(13), List.of());
        assertTrue(acesUpOverNines.compareTo(acesUpOverEights) > 0);
    }

    @Test
    void testKickersComparedLeftToRight() {
        HandResult first = HandResult.of(HandCategory.HIGH_CARD, 14, 0, List.of(10, 7, 4, 3), List.of());
        HandResult second = HandResult.of(HandCategory.HIGH_CARD, 14, 0, List.of(10, 7, 4, 2), List.of());
        assertTrue(first.compareTo(second) > 0);
        assertTrue(second.compareTo(first) < 0);
    }

    @Test
    void testKickersAreImmutableCopies() {
        List<Integer> kickers = new ArrayList<>(List.of(9, 5));
        HandResult result = HandResult.of(HandCategory.ONE_PAIR, 12, 0, kickers, List.of());
        kickers.add(2);

        assertEquals(List.of(9, 5), result.getKickers());
        assertThrows(UnsupportedOperationException.class, () -> result.getKickers().add(3));
    }

    @Test
    void testDescriptions() {
        assertEquals("Four of a Kind, Sixes", HandResult.describe(HandCategory.FOUR_OF_A_KIND, 6, 0));
        assertEquals("Flush, Jack high", HandResult.describe(HandCategory.FLUSH, 11, 0));
        assertEquals("High Card, Ace", HandResult.describe(HandCategory.HIGH_CARD, 14, 0));
    }

    @Test
    void testInvalidSentinel() {
        HandResult sentinel = HandResult.invalidHoleCards();
        assertEquals(HandCategory.HIGH_CARD, sentinel.getCategory());
        assertEquals(HandResult.INVALID_HOLE_CARDS, sentinel.getDescription());
        assertTrue(sentinel.getKickers().isEmpty());
        assertTrue(sentinel.getCardsUsed().isEmpty());
    }

    @Test
    void testOnlyTheSentinelIsInvalid() {
        HandResult lookalike = new HandResult(HandCategory.HIGH_CARD, 0, 0, List.of(),
                HandResult.INVALID_HOLE_CARDS, List.of());

        assertSame(HandResult.invalidHoleCards(), HandResult.invalidHoleCards());
        assertTrue(HandResult.invalidHoleCards().isInvalid());
        assertFalse(lookalike.isInvalid(), "a matching description alone is not the sentinel");
        assertFalse(HandResult.of(HandCategory.HIGH_CARD, 14, 0, List.of(9, 7, 4, 2), List.of()).isInvalid());
    }

    @Test
    void testDescriptionsUseCategoryNames() {
        assertEquals("Royal Flush", HandResult.describe(HandCategory.ROYAL_FLUSH, 14, 0));
        assertEquals("Straight Flush, Five high", HandResult.describe(HandCategory.STRAIGHT_FLUSH, 5, 0));
        assertEquals("Full House, Kings full of Sevens", HandResult.describe(HandCategory.FULL_HOUSE, 13, 7));
        assertEquals("Two Pair, Jacks and Fours", HandResult.describe(HandCategory.TWO_PAIR, 11, 4));
        assertEquals("Pair of Tens", HandResult.describe(HandCategory.ONE_PAIR, 10, 0));
    }
}
