package com.jreinhal.zerag.exception;

public class EmbeddingDimensionMismatchException extends EmbeddingException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but model returned " + actual
                + "; run the embedding dimension migration and re-sync all data sources");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return this.expected;
    }

    public int getActual() {
        return this.actual;
    }
}
