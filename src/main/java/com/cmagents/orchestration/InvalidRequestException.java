package com.cmagents.orchestration;

/**
 * Raised for requests or configuration that can never produce a valid run.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
