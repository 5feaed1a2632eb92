package com.flagship.school_billing.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StudentDebtSummary {
    Long studentId;
    String studentName;
    BigDecimal monthlyOwed;
    BigDecimal totalPaid;
    BigDecimal debt;
    BigDecimal balance;

    public boolean hasDebt() {
        return debt.signum() > 0;
    }
}
