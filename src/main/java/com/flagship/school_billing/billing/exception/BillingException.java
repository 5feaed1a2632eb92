package com.flagship.school_billing.billing.exception;

/**
 * Base type for every failure surfaced by the billing core.
 *
 * All subclasses are unchecked: a failed write rolls back the surrounding
 * transaction, so callers never observe a partially applied charge.
 */
public abstract class BillingException extends RuntimeException {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
