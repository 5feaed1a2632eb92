package com.flagship.school_billing.course;

import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Domain view of a course's billing parameters.
 *
 * The per-lesson price is always derived from the current {@code cost} and
 * {@code lessonPerMonth}; it is never stored, so repricing a course affects
 * every later charge and reversal.
 */
@Value
public class Course {

    /**
     * Precision used for the per-lesson division. Prices such as 100 / 3 do
     * not terminate, so a bounded context is required; reversals recompute
     * the same quotient and therefore cancel exactly.
     */
    public static final MathContext LESSON_COST_PRECISION = MathContext.DECIMAL128;

    Long id;
    String name;
    BigDecimal cost;
    int lessonPerMonth;

    public BigDecimal lessonCost() {
        if (lessonPerMonth <= 0) {
            throw new IllegalStateException(
                String.format("Course %s has invalid lesson_per_month=%d", id, lessonPerMonth));
        }
        return cost.divide(BigDecimal.valueOf(lessonPerMonth), LESSON_COST_PRECISION);
    }
}
