package com.pokerplayer.strength.service;

import com.pokerplayer.evaluator.Card;
import com.pokerplayer.evaluator.CombinationEvaluator;
import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.strength.TestCards;
import com.pokerplayer.strength.config.ClassifierThresholds;
import com.pokerplayer.strength.model.EvaluationSource;
import com.pokerplayer.strength.model.StrengthAssessment;
import com.pokerplayer.strength.model.StrengthTier;
import com.pokerplayer.strength.oracle.RankOracleClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.pokerplayer.strength.TestCards.cards;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HandStrengthClassifierTest {

    private HandStrengthClassifier classifier;

    @BeforeEach
    void setUp() {
        RankOracleClient oracle = mock(RankOracleClient.class);
        when(oracle.isEnabled()).thenReturn(false);
        HybridHandRanker ranker = new HybridHandRanker(new CombinationEvaluator(), oracle);
        classifier = new HandStrengthClassifier(ranker, ClassifierThresholds.defaults());
    }

    @ParameterizedTest(name = "{0} {1} -> {2}")
    @CsvSource({
            "As, Ah, STRONG",
            "10s, 10d, STRONG",
            "Ad, Kc, STRONG",
            "Qh, Ac, STRONG",
            "9s, 9d, DECENT",
            "2c, 2d, DECENT",
            "Ad, Jc, DECENT",
            "9s, 2d, DECENT",
            "8h, 7h, DECENT",
            "Kd, 3c, DECENT",
            "8h, 5h, WEAK_PLAYABLE",
            "8c, 7d, WEAK_PLAYABLE",
            "7h, 3h, WEAK_PLAYABLE",
            "8c, 6d, MARGINAL",
            "5c, 3d, MARGINAL",
            "8c, 3d, TRASH",
            "7c, 2d, TRASH"
    })
    void testPreflopTiers(String first, String second, StrengthTier expected) {
        assertEquals(expected, classifier.classify(cards(first, second), List.of(), false));
    }

    @ParameterizedTest(name = "heads-up {0} {1} -> {2}")
    @CsvSource({
            "8c, 3d, DECENT",
            "7h, 4h, DECENT",
            "7c, 5d, WEAK_PLAYABLE",
            "7c, 4d, TRASH",
            "As, Ah, STRONG"
    })
    void testHeadsUpWidening(String first, String second, StrengthTier expected) {
        assertEquals(expected, classifier.classify(cards(first, second), List.of(), true));
    }

    @Test
    void testEveryStartingHandHasOneTierAndHeadsUpNeverLowersIt() {
        List<Card> deck = TestCards.fullDeck();
        int hands = 0;
        for (int i = 0; i < deck.size(); i++) {
            for (int j = i + 1; j < deck.size(); j++) {
                List<Card> hole = List.of(deck.get(i), deck.get(j));
                StrengthTier regular = classifier.classify(hole, List.of(), false);
                StrengthTier headsUp = classifier.classify(hole, List.of(), true);

                assertNotNull(regular, hole::toString);
                assertNotNull(headsUp, hole::toString);
                assertTrue(headsUp.isAtLeast(regular), () -> hole + ": " + headsUp + " < " + regular);
                hands++;
            }
        }
        assertEquals(1326, hands);
    }

    @Test
    void testInvalidHoleCardsAreTrash() {
        assertEquals(StrengthTier.TRASH, classifier.classify(cards("As"), List.of(), false));
        assertEquals(StrengthTier.TRASH, classifier.classify(null, cards("Kd", "9c", "5s"), true));

        StrengthAssessment assessment = classifier.assess(cards("As"), cards("Kd", "9c", "5s"), false);
        assertTrue(assessment.getHand().getResult().isInvalid());
    }

    @Test
    void testPartialBoardUsesPreflopRules() {
        assertEquals(StrengthTier.STRONG, classifier.classify(cards("As", "Kd"), cards("2c"), false));
        assertEquals(StrengthTier.TRASH, classifier.classify(cards("7c", "2d"), cards("7h", "2s"), false));
    }

    @ParameterizedTest(name = "{0} on {1} -> {2}")
    @CsvSource({
            // made hands
            "Ah 9h, 2h 5h Kh, PREMIUM",
            "Kh 2h, 3h 5h 9h, PREMIUM",
            "7h 2h, 3h 5h 9h, STRONG",
            "9c 8d, 7h 6s 5c, PREMIUM",
            "9c 8d, 7h 6h 5h, STRONG",
            "9c 8d, 7h 7s 6c 5d, STRONG",
            "7c 7d, 7h Ks 2c, STRONG",
            "Kc Qd, Kh Qs 2c, STRONG",
            "Jc 4d, Jh 4s Kc, STRONG",
            "10c 4d, 10h 4s Kc, DECENT",
            "9c 8d, 9h 8s 2c, DECENT",
            "Kc 3d, Kh 8s 2c, STRONG",
            "10c 3d, 10h 7s 2c, DECENT",
            "5c 2d, 5h 9s Kc, DECENT",
            "6c 2d, 6h 7s 9c, WEAK_PLAYABLE",
            // demotion on paired or flush-possible boards
            "9c 4d, 9h 2s 2c, WEAK_PLAYABLE",
            "10c 4d, 10h 4h Kh, WEAK_PLAYABLE",
            "Kc 3d, Kh 8h 2h, DECENT",
            "10c 3d, 10h 7h 2h, WEAK_PLAYABLE",
            "6c 2d, 6h 7h 9h, WEAK_PLAYABLE",
            // high card with and without draws
            "Ac 4d, Kh 9s 6c, WEAK_PLAYABLE",
            "8h 3h, Kh 9h 2c, WEAK_PLAYABLE",
            "8c 7d, 6h 5s Kc, WEAK_PLAYABLE",
            "4c 2d, Kh 9s 7c, MARGINAL",
            "3c 2d, Kh 9s 7c 5d Jh, MARGINAL",
            "Ac 4d, Kh 9s 6c 3h 2s, MARGINAL"
    })
    void testPostflopTiers(String hole, String board, StrengthTier expected) {
        assertEquals(expected, classifier.classify(cards(hole.split(" ")), cards(board.split(" ")), false));
    }

    @Test
    void testHeadsUpDoesNotChangePostflop() {
        List<Card> hole = cards("6c", "2d");
        List<Card> board = cards("6h", "7s", "9c");
        assertEquals(classifier.classify(hole, board, false), classifier.classify(hole, board, true));
    }

    @Test
    void testAssessmentCarriesRankedHand() {
        StrengthAssessment assessment = classifier.assess(cards("Kc", "Qd"), cards("Kh", "Qs", "2c"), false);

        assertEquals(StrengthTier.STRONG, assessment.getTier());
        assertEquals(HandCategory.TWO_PAIR, assessment.getHand().getResult().getCategory());
        assertEquals(EvaluationSource.LOCAL, assessment.getHand().getSource());
    }
}
