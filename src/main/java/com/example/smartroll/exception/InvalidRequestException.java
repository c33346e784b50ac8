package com.example.smartroll.exception;

/**
 * A caller-supplied value failed a precondition. The only fault mapped to the
 * invalid-argument response; any other {@link IllegalArgumentException} is a server error.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
