package com.jreinhal.zerag.exception;

public class RerankerException extends RuntimeException {

    public RerankerException(String message) {
        super(message);
    }

    public RerankerException(String message, Throwable cause) {
        super(message, cause);
    }
}
