package com.pokerplayer.strength.dto;

import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.strength.model.EvaluationSource;
import com.pokerplayer.strength.model.StrengthAssessment;
import com.pokerplayer.strength.model.StrengthTier;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ClassificationResponse {
    private StrengthTier tier;
    private HandCategory category;
    private String description;
    private EvaluationSource source;

    public static ClassificationResponse from(StrengthAssessment assessment) {
        return ClassificationResponse.builder()
                .tier(assessment.getTier())
                .category(assessment.getHand().getResult().getCategory())
                .description(assessment.getHand().getResult().getDescription())
                .source(assessment.getHand().getSource())
                .build();
    }
}
