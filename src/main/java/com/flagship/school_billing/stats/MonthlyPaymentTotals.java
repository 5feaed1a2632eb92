package com.flagship.school_billing.stats;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment totals for each month of a year. Always holds all twelve months,
 * in calendar order; months without payments are zero.
 */
@Value
public class MonthlyPaymentTotals {
    int year;
    Map<Integer, BigDecimal> byMonth;

    public static MonthlyPaymentTotals of(int year, Map<Integer, BigDecimal> recorded) {
        if (recorded.keySet().stream().anyMatch(m -> m < 1 || m > 12)) {
            throw new IllegalArgumentException("Month outside 1-12 in " + recorded.keySet());
        }
        Map<Integer, BigDecimal> months = new LinkedHashMap<>();
        for (int month = 1; month <= 12; month++) {
            months.put(month, recorded.getOrDefault(month, BigDecimal.ZERO));
        }
        return new MonthlyPaymentTotals(year, Collections.unmodifiableMap(months));
    }

    public BigDecimal total() {
        return byMonth.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
