package com.bucketcopy.objectCopy;

/**
 * Thrown before any call to the store when a copy can not be planned.
 */
public class InvalidCopyRequestException extends IllegalArgumentException {
    public InvalidCopyRequestException(String message) {
        super(message);
    }
    public InvalidCopyRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
