package com.pokerplayer.evaluator;

/**
 * Thrown when a rank or suit cannot be parsed into a {@link Card}.
 */
public class InvalidCardException extends IllegalArgumentException {

    public InvalidCardException(String message) {
        super(message);
    }
}
