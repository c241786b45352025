package com.example.datalake.mnemo.exception;

public class VectorDimensionException extends MemoryException {

    private final int expected;
    private final int actual;

    public VectorDimensionException(int expected, int actual) {
        super("Vector dimension mismatch: expected %d, got %d".formatted(expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
