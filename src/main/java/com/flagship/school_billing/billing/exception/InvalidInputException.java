package com.flagship.school_billing.billing.exception;

public class InvalidInputException extends BillingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
