package com.cern.json;

/**
 * Thrown when a syntax tree cannot be written to or read from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
