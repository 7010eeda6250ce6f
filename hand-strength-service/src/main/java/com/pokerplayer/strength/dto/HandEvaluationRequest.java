package com.pokerplayer.strength.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class HandEvaluationRequest {
    private List<CardPayload> holeCards = new ArrayList<>();
    private List<CardPayload> communityCards = new ArrayList<>();
    private boolean headsUp; // only read by /classify
}
