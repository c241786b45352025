package com.example.datalake.mnemo.exception;

/** The embedding model could not produce a vector, even after recovery. */
public class EmbeddingException extends MemoryException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }

    public EmbeddingException(String message) {
        super(message);
    }
}
