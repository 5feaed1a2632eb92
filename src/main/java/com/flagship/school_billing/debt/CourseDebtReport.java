package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class CourseDebtReport {
    Long courseId;
    String courseName;
    BigDecimal monthlyFee;
    LocalDate evaluatedOn;
    List<CourseStudentDebt> students;
    BigDecimal totalCourseDebt;
    int studentsWithDebt;
}
