package com.pokerplayer.strength.oracle;

/**
 * The ranking oracle could not produce a usable answer: timeout, transport error,
 * non-success status or a body that does not match the expected schema.
 */
public class OracleUnavailableException extends Exception {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
