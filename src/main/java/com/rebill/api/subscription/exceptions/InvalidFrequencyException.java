package com.rebill.api.subscription.exceptions;

/**
 * Thrown when a billing interval is requested for a subscription without a known frequency. It
 * signals a corrupt row rather than bad input, since inputs are validated on creation.
 */
public class InvalidFrequencyException extends IllegalStateException {

    public InvalidFrequencyException(String message) {
        super(message);
    }
}
