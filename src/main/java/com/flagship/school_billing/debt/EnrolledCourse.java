package com.flagship.school_billing.debt;

import com.flagship.school_billing.course.Course;
import com.flagship.school_billing.enrollment.Enrollment;
import lombok.Value;

/**
 * An enrollment paired with its course's current billing parameters.
 */
@Value(staticConstructor = "of")
public class EnrolledCourse {
    Enrollment enrollment;
    Course course;
}
