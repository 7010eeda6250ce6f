package com.pokerplayer.strength.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pokerplayer.strength.TestCards.cards;
import static org.junit.jupiter.api.Assertions.*;

class BoardTextureTest {

    @Test
    void testPreflopBoardHasNoTexture() {
        BoardTexture texture = BoardTexture.of(cards("Ah", "Ad"));
        assertFalse(texture.isPaired());
        assertFalse(texture.isFlushPossible());
        assertFalse(texture.isCoordinated());
        assertEquals(texture, BoardTexture.of(List.of()));
        assertEquals(texture, BoardTexture.of(null));
    }

    @Test
    void testPairedBoard() {
        assertTrue(BoardTexture.of(cards("9h", "9s", "2c")).isPaired());
        assertFalse(BoardTexture.of(cards("9h", "8s", "2c")).isPaired());
    }

    @Test
    void testFlushPossible() {
        assertTrue(BoardTexture.of(cards("2h", "7h", "Kh")).isFlushPossible());
        assertFalse(BoardTexture.of(cards("2h", "7h", "Ks", "Kc")).isFlushPossible());
    }

    @Test
    void testCoordinated() {
        assertTrue(BoardTexture.of(cards("6h", "8s", "Kc")).isCoordinated());
        assertFalse(BoardTexture.of(cards("2h", "7s", "Qc")).isCoordinated());
        // a pair is not coordination
        assertFalse(BoardTexture.of(cards("7h", "7s", "Qc")).isCoordinated());
    }
}
