package com.example.datalake.mnemo.exception;

public class InvalidOwnerException extends MemoryException {

    public InvalidOwnerException(long ownerId) {
        super("Owner id must be positive, got " + ownerId);
    }
}
