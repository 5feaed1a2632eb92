package com.flagship.school_billing.enrollment;

import lombok.Value;

import java.time.LocalDate;

/**
 * A student's enrollment in a course. The enrollment date anchors monthly
 * billing; {@code lessonsAttended} is the course-scoped counter used for
 * expected-vs-actual reporting and is independent of the student's billed
 * lesson count.
 */
@Value
public class Enrollment {
    Long id;
    Long studentId;
    Long courseId;
    LocalDate enrollmentDate;
    int lessonsAttended;
}
