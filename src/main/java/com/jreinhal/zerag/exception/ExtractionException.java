package com.jreinhal.zerag.exception;

/**
 * Text could not be extracted from one source unit. Callers skip the unit.
 */
public class ExtractionException extends Exception {

    public enum Reason {
        UNSUPPORTED_FORMAT,
        PARSE_ERROR,
        NOT_FOUND
    }

    private final Reason reason;

    public ExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return this.reason;
    }
}
