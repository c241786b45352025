package com.example.datalake.mnemo.exception;

/** Base class for failures raised by the memory engine. */
public class MemoryException extends RuntimeException {

    public MemoryException(String message) {
        super(message);
    }

    public MemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
