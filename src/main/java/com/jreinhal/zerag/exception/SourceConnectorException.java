package com.jreinhal.zerag.exception;

public class SourceConnectorException extends RuntimeException {

    public SourceConnectorException(String message) {
        super(message);
    }

    public SourceConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
