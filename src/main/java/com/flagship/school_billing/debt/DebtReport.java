package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Monthly debt of one student as of {@code evaluatedOn}.
 *
 * {@code balance = totalPaid - totalMonthlyOwed}; a negative balance is debt.
 * Amounts are unrounded.
 */
@Value
@Builder
public class DebtReport {
    Long studentId;
    String studentName;
    LocalDate evaluatedOn;
    List<CourseDebtLine> courseBreakdown;
    BigDecimal totalMonthlyOwed;
    BigDecimal totalPaid;
    BigDecimal balance;
    boolean owesMoney;
    BigDecimal debtAmount;
    BigDecimal overpaidAmount;
}
