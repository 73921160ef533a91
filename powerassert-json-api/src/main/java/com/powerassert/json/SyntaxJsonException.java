package com.powerassert.json;

/**
 * Exception thrown when JSON serialization or deserialization of a syntax tree fails.
 */
public class SyntaxJsonException extends RuntimeException {

    public SyntaxJsonException(String message) {
        super(message);
    }

    public SyntaxJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public SyntaxJsonException(Throwable cause) {
        super(cause);
    }
}
