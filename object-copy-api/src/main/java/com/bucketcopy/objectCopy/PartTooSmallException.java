package com.bucketcopy.objectCopy;

public class PartTooSmallException extends RuntimeException {
    public PartTooSmallException(String message, Throwable cause) {
        super(message, cause);
    }
    public PartTooSmallException(String message) {
        super(message);
    }
}
