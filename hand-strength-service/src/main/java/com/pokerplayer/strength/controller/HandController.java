package com.pokerplayer.strength.controller;

import com.pokerplayer.evaluator.Card;
import com.pokerplayer.strength.dto.CardPayload;
import com.pokerplayer.strength.dto.ClassificationResponse;
import com.pokerplayer.strength.dto.HandEvaluationRequest;
import com.pokerplayer.strength.dto.HandEvaluationResponse;
import com.pokerplayer.strength.service.HandStrengthClassifier;
import com.pokerplayer.strength.service.HybridHandRanker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/hands")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class HandController {

    private final HybridHandRanker ranker;
    private final HandStrengthClassifier classifier;

    public HandController(HybridHandRanker ranker, HandStrengthClassifier classifier) {
        this.ranker = ranker;
        this.classifier = classifier;
    }

    /**
     * POST /api/hands/evaluate
     * Best hand from hole and community cards
     */
    @PostMapping("/evaluate")
    public ResponseEntity<HandEvaluationResponse> evaluate(@RequestBody HandEvaluationRequest request) {
        return ResponseEntity.ok(HandEvaluationResponse.from(
                ranker.evaluate(toCards(request.getHoleCards()), toCards(request.getCommunityCards()))));
    }

    /**
     * POST /api/hands/classify
     * Strength tier for betting decisions
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassificationResponse> classify(@RequestBody HandEvaluationRequest request) {
        return ResponseEntity.ok(ClassificationResponse.from(
                classifier.assess(toCards(request.getHoleCards()), toCards(request.getCommunityCards()),
                        request.isHeadsUp())));
    }

    private static List<Card> toCards(List<CardPayload> payloads) {
        if (payloads == null) {
            return List.of();
        }
        return payloads.stream()
                .map(CardPayload::toCard)
                .collect(Collectors.toList());
    }
}
