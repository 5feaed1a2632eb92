package com.flagship.school_billing.attendance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A student's billed lesson count and running money balance.
 *
 * {@link #charge} and {@link #reverse} are exact inverses for the same record
 * and lesson cost, which is what keeps the count and the balance consistent
 * across any sequence of attendance updates.
 */
@Value
public class LessonBalance {
    int numLesson;
    BigDecimal totalMoney;

    public LessonBalance(int numLesson, BigDecimal totalMoney) {
        this.numLesson = numLesson;
        this.totalMoney = Objects.requireNonNull(totalMoney, "totalMoney");
    }

    public static LessonBalance zero() {
        return new LessonBalance(0, BigDecimal.ZERO);
    }

    /**
     * Applies the financial effect of a record.
     */
    public LessonBalance charge(AttendanceRecord record, BigDecimal lessonCost) {
        if (!record.isChargeMoney()) {
            return this;
        }
        return new LessonBalance(
            record.consumesLesson() ? numLesson + 1 : numLesson,
            totalMoney.subtract(lessonCost)
        );
    }

    /**
     * Undoes the financial effect of a record previously applied with {@link #charge}.
     */
    public LessonBalance reverse(AttendanceRecord record, BigDecimal lessonCost) {
        if (!record.isChargeMoney()) {
            return this;
        }
        return new LessonBalance(
            record.consumesLesson() ? numLesson - 1 : numLesson,
            totalMoney.add(lessonCost)
        );
    }

    public LessonBalance credit(BigDecimal amount) {
        return new LessonBalance(numLesson, totalMoney.add(amount));
    }
}
