package com.flagship.school_billing.billing.exception;

/**
 * Unknown student, course or enrollment, or an update against an attendance
 * key that has no record.
 */
public class NotFoundException extends BillingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException student(Long studentId) {
        return new NotFoundException("Student not found: " + studentId);
    }

    public static NotFoundException course(Long courseId) {
        return new NotFoundException("Course not found: " + courseId);
    }

    public static NotFoundException enrollment(Long studentId, Long courseId) {
        return new NotFoundException(
            String.format("Student %s is not enrolled in course %s", studentId, courseId));
    }
}
