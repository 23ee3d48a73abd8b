package com.agronet.marketplace.exception;

/**
 * Exception thrown when a request collides with existing state,
 * e.g. a second pending application from the same applicant.
 *
 * @author Agronet Marketplace Team
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
