package com.agronet.marketplace.exception;

/**
 * Exception thrown when the caller's ownership or role does not permit the requested operation.
 *
 * @author Agronet Marketplace Team
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
