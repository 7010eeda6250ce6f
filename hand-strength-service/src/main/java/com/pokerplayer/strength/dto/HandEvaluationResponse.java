package com.pokerplayer.strength.dto;

import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.strength.model.EvaluationSource;
import com.pokerplayer.strength.model.RankedHand;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class HandEvaluationResponse {
    private HandCategory category;
    private int primaryValue;
    private int secondaryValue;
    private List<Integer> kickers;
    private String description;
    private List<CardPayload> cardsUsed;
    private EvaluationSource source;

    public static HandEvaluationResponse from(RankedHand hand) {
        return HandEvaluationResponse.builder()
                .category(hand.getResult().getCategory())
                .primaryValue(hand.getResult().getPrimaryValue())
                .secondaryValue(hand.getResult().getSecondaryValue())
                .kickers(hand.getResult().getKickers())
                .description(hand.getResult().getDescription())
                .cardsUsed(hand.getResult().getCardsUsed().stream()
                        .map(CardPayload::from)
                        .collect(Collectors.toList()))
                .source(hand.getSource())
                .build();
    }
}
