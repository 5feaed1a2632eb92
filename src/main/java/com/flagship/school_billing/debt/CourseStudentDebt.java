package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One enrolled student's standing within a single course. Only payments made
 * against that course are counted.
 */
@Value
@Builder
public class CourseStudentDebt {
    Long studentId;
    String studentName;
    long monthsEnrolled;
    int lessonsAttended;
    long expectedLessons;
    BigDecimal courseOwed;
    BigDecimal coursePayments;
    BigDecimal balance;
    BigDecimal debt;
}
