package com.flagship.school_billing.payment;

import com.flagship.school_billing.billing.exception.InvalidInputException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment made by a student against a course. Append-only: once recorded
 * it is never changed by the billing core.
 */
@Value
public class Payment {

    public static final String DEFAULT_DESCRIPTION = "Monthly payment";
    public static final int MAX_DESCRIPTION_LENGTH = 200;

    Long id;
    Long studentId;
    Long courseId;
    BigDecimal amount;
    LocalDate paymentDate;
    String description;

    /**
     * Creates a not-yet-persisted payment after validating its inputs.
     *
     * @throws InvalidInputException if the amount is missing or not positive, the date is missing
     *                               or the description is too long
     */
    public static Payment record(Long studentId, Long courseId, BigDecimal amount,
                                 LocalDate paymentDate, String description) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("Payment amount must be positive, got " + amount);
        }
        if (paymentDate == null) {
            throw new InvalidInputException("Payment date is required");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidInputException(String.format(
                "Payment description is %d characters long, at most %d allowed",
                description.length(), MAX_DESCRIPTION_LENGTH));
        }
        return new Payment(
            null,
            studentId,
            courseId,
            amount,
            paymentDate,
            description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description
        );
    }
}
