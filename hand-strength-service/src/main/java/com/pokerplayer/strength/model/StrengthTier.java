package com.pokerplayer.strength.model;

/**
 * Coarse hand strength used by betting logic instead of a raw hand category.
 */
public enum StrengthTier {
    /**
     * Unplayable, fold unless checking is free
     */
    TRASH,

    /**
     * Bluff candidates
     */
    MARGINAL,

    /**
     * Marginal but playable
     */
    WEAK_PLAYABLE,

    DECENT,

    STRONG,

    /**
     * Nuts or near-nuts
     */
    PREMIUM;

    public boolean isAtLeast(StrengthTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * One tier lower, but never below {@code floor}.
     */
    public StrengthTier demotedTo(StrengthTier floor) {
        if (this.compareTo(floor) <= 0) {
            return this;
        }
        StrengthTier lower = values()[ordinal() - 1];
        return lower.compareTo(floor) < 0 ? floor : lower;
    }
}
