package com.flagship.school_billing.stats;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * School-wide money overview.
 *
 * {@code totalMoney} is the sum of all students' running balances;
 * {@code monthlyMoney} the payments dated in {@code month}.
 */
@Value
@Builder
public class BillingStatistics {
    YearMonth month;
    BigDecimal totalMoney;
    BigDecimal monthlyMoney;
    long totalStudents;
}
