package com.flagship.school_billing.stats;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Payments of one student set against the running balance.
 *
 * The running balance already contains every payment credit, so
 * {@code attendanceBalance = runningBalance - totalPaid} is what attendance
 * charges alone did to the balance.
 */
@Value
public class StudentPaymentSummary {
    Long studentId;
    String studentName;
    BigDecimal totalPaid;
    BigDecimal runningBalance;
    BigDecimal attendanceBalance;

    public static StudentPaymentSummary of(Long studentId, String studentName,
                                           BigDecimal totalPaid, BigDecimal runningBalance) {
        return new StudentPaymentSummary(studentId, studentName, totalPaid, runningBalance,
            runningBalance.subtract(totalPaid));
    }
}
