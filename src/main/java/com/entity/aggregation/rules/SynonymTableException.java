package com.entity.aggregation.rules;

/**
 * Thrown when a synonym table cannot be read or is malformed.
 */
public class SynonymTableException extends RuntimeException {

    public SynonymTableException(String message) {
        super(message);
    }

    public SynonymTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
