package com.flagship.school_billing.payment;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Sum of all payments recorded against one course.
 */
@Value
public class CoursePaymentTotal {
    Long courseId;
    String courseName;
    BigDecimal totalAmount;
}
