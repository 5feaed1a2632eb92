package com.flagship.school_billing.billing.exception;

/**
 * The requested state already exists (e.g. a duplicate enrollment).
 */
public class ConflictException extends BillingException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
