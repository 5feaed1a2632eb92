package com.flagship.school_billing.billing.exception;

/**
 * A write for a student kept losing against concurrent writers and the retry
 * budget ran out. Nothing from the failed attempts was committed.
 */
public class ConcurrencyConflictException extends BillingException {

    private final int attempts;

    public ConcurrencyConflictException(String operation, Long studentId, int attempts, Throwable cause) {
        super(String.format("Concurrent modification of student %s during %s, gave up after %d attempts",
                studentId, operation, attempts), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
