package com.flagship.school_billing.stats;

import com.flagship.school_billing.billing.exception.InvalidInputException;
import com.flagship.school_billing.billing.exception.NotFoundException;
import com.flagship.school_billing.payment.CoursePaymentTotal;
import com.flagship.school_billing.payment.PaymentLedger;
import com.flagship.school_billing.student.StudentEntity;
import com.flagship.school_billing.student.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Read-only payment statistics. Like {@link com.flagship.school_billing.debt.DebtCalculationService}
 * it leaves transaction boundaries to the caller.
 */
@Service
@RequiredArgsConstructor
public class StatisticsService {

    static final int MIN_YEAR = 1;
    static final int MAX_YEAR = 9999;

    private final PaymentLedger paymentLedger;
    private final StudentRepository studentRepository;

    public BillingStatistics statistics(YearMonth currentMonth) {
        BigDecimal totalMoney = studentRepository.sumTotalMoney();
        return BillingStatistics.builder()
            .month(currentMonth)
            .totalMoney(totalMoney != null ? totalMoney : BigDecimal.ZERO)
            .monthlyMoney(paymentLedger.totalPaidInMonth(currentMonth))
            .totalStudents(studentRepository.count())
            .build();
    }

    public MonthlyPaymentTotals monthlyStatistics(int year) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidInputException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
        return MonthlyPaymentTotals.of(year, paymentLedger.totalPaidPerMonth(year));
    }

    public List<CoursePaymentTotal> paymentsByCourse() {
        return paymentLedger.totalPaidPerCourse();
    }

    public StudentPaymentSummary studentPaymentSummary(Long studentId) {
        StudentEntity student = studentRepository.findById(studentId)
            .orElseThrow(() -> NotFoundException.student(studentId));
        return StudentPaymentSummary.of(student.getId(), student.getDisplayName(),
            paymentLedger.totalPaidByStudent(studentId), student.getTotalMoney());
    }
}
