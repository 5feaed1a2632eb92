package com.flagship.school_billing.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only payment store and payment totals.
 *
 * Totals are derived with SQL aggregates over the payments table, never
 * stored, so they cannot drift from the individual payment rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedger {

    private final PaymentRepository paymentRepository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment append(Payment payment) {
        if (payment.getId() != null) {
            throw new IllegalArgumentException("Payment " + payment.getId() + " is already recorded");
        }
        PaymentEntity saved = paymentRepository.save(PaymentEntity.fromDomain(payment));
        log.debug("Appended payment {} of {} for student {} / course {}",
                saved.getId(), saved.getAmount(), saved.getStudentId(), saved.getCourseId());
        return saved.toDomain();
    }

    public List<Payment> findByStudent(Long studentId) {
        return paymentRepository.findByStudentIdOrderByPaymentDateAscIdAsc(studentId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Sum of all payments of one student; zero when there are none.
     */
    public BigDecimal totalPaidByStudent(Long studentId) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM payments WHERE student_id = ?",
            BigDecimal.class,
            studentId
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    /**
     * Payment totals for every student that has paid at least once.
     */
    public Map<Long, BigDecimal> totalPaidPerStudent() {
        Map<Long, BigDecimal> totals = new HashMap<>();
        jdbcTemplate.query(
            "SELECT student_id, SUM(amount) AS total FROM payments GROUP BY student_id",
            rs -> {
                totals.put(rs.getLong("student_id"), rs.getBigDecimal("total"));
            }
        );
        return totals;
    }

    /**
     * Payment totals per student, restricted to payments recorded against one course.
     */
    public Map<Long, BigDecimal> totalPaidPerStudentForCourse(Long courseId) {
        Map<Long, BigDecimal> totals = new HashMap<>();
        jdbcTemplate.query(
            "SELECT student_id, SUM(amount) AS total FROM payments WHERE course_id = ? GROUP BY student_id",
            rs -> {
                totals.put(rs.getLong("student_id"), rs.getBigDecimal("total"));
            },
            courseId
        );
        return totals;
    }

    /**
     * Sum of payments dated within {@code month}; zero when there are none.
     */
    public BigDecimal totalPaidInMonth(YearMonth month) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM payments WHERE payment_date >= ? AND payment_date < ?",
            BigDecimal.class,
            month.atDay(1),
            month.plusMonths(1).atDay(1)
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    /**
     * Payment totals per calendar month (1-12) of {@code year}. Months
     * without payments are absent from the map.
     */
    public Map<Integer, BigDecimal> totalPaidPerMonth(int year) {
        Map<Integer, BigDecimal> totals = new HashMap<>();
        jdbcTemplate.query(
            "SELECT CAST(EXTRACT(MONTH FROM payment_date) AS INTEGER) AS payment_month, SUM(amount) AS total "
                + "FROM payments WHERE payment_date >= ? AND payment_date < ? "
                + "GROUP BY payment_month",
            rs -> {
                totals.put(rs.getInt("payment_month"), rs.getBigDecimal("total"));
            },
            LocalDate.of(year, 1, 1),
            LocalDate.of(year + 1, 1, 1)
        );
        return totals;
    }

    /**
     * Payment totals per course, ordered by course name. Courses without
     * payments are not listed.
     */
    public List<CoursePaymentTotal> totalPaidPerCourse() {
        return jdbcTemplate.query(
            "SELECT c.id AS course_id, c.name AS course_name, SUM(p.amount) AS total "
                + "FROM payments p JOIN courses c ON c.id = p.course_id "
                + "GROUP BY c.id, c.name ORDER BY c.name, c.id",
            (rs, rowNum) -> new CoursePaymentTotal(
                rs.getLong("course_id"),
                rs.getString("course_name"),
                rs.getBigDecimal("total")
            )
        );
    }
}
