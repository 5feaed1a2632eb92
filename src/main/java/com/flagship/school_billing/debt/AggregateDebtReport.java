package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Debt summary across all students.
 */
@Value
@Builder
public class AggregateDebtReport {
    LocalDate evaluatedOn;
    List<StudentDebtSummary> students;
    BigDecimal totalDebtAllStudents;
    int studentsWithDebt;
}
