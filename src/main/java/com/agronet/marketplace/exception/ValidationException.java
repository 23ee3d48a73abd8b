package com.agronet.marketplace.exception;

/**
 * Exception thrown when a request is malformed or violates a category-specific field rule.
 * Always raised before any state is mutated.
 *
 * @author Agronet Marketplace Team
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return the offending request field, or null when the rule spans several fields
     */
    public String getField() {
        return field;
    }
}
