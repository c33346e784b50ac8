package com.example.smartroll.exception;

/**
 * Raised when a device identifier does not match the hardware address pattern.
 */
public class InvalidIdentifierException extends InvalidRequestException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
