package com.pokerplayer.strength.model;

/**
 * Where a hand result came from. Informational only; both sources yield the same categories.
 */
public enum EvaluationSource {
    ORACLE,
    LOCAL
}
