package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-course entry of a student's debt report.
 */
@Value
@Builder
public class CourseDebtLine {
    Long courseId;
    String courseName;
    BigDecimal monthlyFee;
    long monthsEnrolled;
    int lessonsAttended;
    long expectedLessons;
    BigDecimal totalOwedForCourse;
    LocalDate enrollmentDate;
}
