package com.flagship.school_billing.billing;

import com.flagship.school_billing.attendance.AttendancePatch;
import com.flagship.school_billing.attendance.AttendanceReconciliationEngine;
import com.flagship.school_billing.attendance.AttendanceRecord;
import com.flagship.school_billing.attendance.StudentLedger;
import com.flagship.school_billing.billing.exception.BillingException;
import com.flagship.school_billing.billing.exception.InvalidInputException;
import com.flagship.school_billing.billing.exception.NotFoundException;
import com.flagship.school_billing.course.Course;
import com.flagship.school_billing.course.CourseEntity;
import com.flagship.school_billing.course.CourseRepository;
import com.flagship.school_billing.debt.AggregateDebtReport;
import com.flagship.school_billing.debt.CourseDebtReport;
import com.flagship.school_billing.debt.DebtCalculationService;
import com.flagship.school_billing.debt.DebtReport;
import com.flagship.school_billing.enrollment.Enrollment;
import com.flagship.school_billing.enrollment.EnrollmentService;
import com.flagship.school_billing.observability.BillingMetrics;
import com.flagship.school_billing.payment.CoursePaymentTotal;
import com.flagship.school_billing.payment.Payment;
import com.flagship.school_billing.payment.PaymentLedger;
import com.flagship.school_billing.stats.BillingStatistics;
import com.flagship.school_billing.stats.MonthlyPaymentTotals;
import com.flagship.school_billing.stats.StatisticsService;
import com.flagship.school_billing.stats.StudentPaymentSummary;
import com.flagship.school_billing.student.StudentEntity;
import com.flagship.school_billing.student.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the billing core for the (external) API layer.
 *
 * Writes:
 * - run through {@link StudentWriteExecutor}: one transaction per attempt,
 *   student row locked first, retried on concurrency failures
 * - either apply completely or not at all
 *
 * Reads run in read-only REPEATABLE_READ transactions, so a report never
 * observes half of a reversal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingFacade {

    static final String STUDENT_ID_MDC_KEY = "studentId";
    static final String OPERATION_MDC_KEY = "operation";

    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentService enrollmentService;
    private final PaymentLedger paymentLedger;
    private final AttendanceReconciliationEngine reconciliationEngine;
    private final DebtCalculationService debtCalculationService;
    private final StatisticsService statisticsService;
    private final StudentWriteExecutor writeExecutor;
    private final BillingMetrics metrics;
    private final Clock clock;

    // ==================== Attendance ====================

    /**
     * Records attendance for (student, course, date). An existing record for
     * the same key is reversed and replaced.
     *
     * @param absent      defaults to {@code false}
     * @param chargeMoney defaults to {@code true}
     * @param reason      defaults to empty
     */
    public AttendanceResult recordAttendance(Long studentId, Long courseId, LocalDate date,
                                             Boolean absent, Boolean chargeMoney, String reason) {
        return write("recordAttendance", studentId, () -> {
            requireDate(date, "Attendance date");
            StudentEntity student = lockStudent(studentId);
            Course course = loadCourse(courseId);

            AttendanceRecord incoming = new AttendanceRecord(
                date,
                courseId,
                absent != null ? absent : false,
                chargeMoney != null ? chargeMoney : true,
                reason
            );
            StudentLedger.Transition transition =
                reconciliationEngine.recordAttendance(student.toLedger(), course, incoming);
            student.applyLedger(transition.getLedger());
            studentRepository.saveAndFlush(student);

            metrics.recordAttendanceEvent(
                transition.replacedExisting() ? "overwritten" : "created", incoming.isChargeMoney());
            log.info("Attendance recorded: course={}, date={}, absent={}, charged={}, numLesson={}, totalMoney={}",
                    courseId, date, incoming.isAbsent(), incoming.isChargeMoney(),
                    transition.getLedger().getBalance().getNumLesson(),
                    transition.getLedger().getBalance().getTotalMoney());
            return new AttendanceResult(studentId, transition.getRecord(),
                transition.getLedger().getBalance(), transition.replacedExisting());
        });
    }

    /**
     * Records a present, charged lesson.
     */
    public AttendanceResult recordAttendance(Long studentId, Long courseId, LocalDate date) {
        return recordAttendance(studentId, courseId, date, null, null, null);
    }

    /**
     * Updates the record for (student, course, date) with the non-null fields of {@code patch}.
     *
     * @throws NotFoundException if the student, the course or the record does not exist
     */
    public AttendanceResult updateAttendance(Long studentId, Long courseId, LocalDate date, AttendancePatch patch) {
        return write("updateAttendance", studentId, () -> {
            requireDate(date, "Attendance date");
            StudentEntity student = lockStudent(studentId);
            Course course = loadCourse(courseId);

            StudentLedger.Transition transition =
                reconciliationEngine.updateAttendance(student.toLedger(), course, date, patch);
            student.applyLedger(transition.getLedger());
            studentRepository.saveAndFlush(student);

            metrics.recordAttendanceEvent("updated", transition.getRecord().isChargeMoney());
            log.info("Attendance updated: course={}, date={}, absent={}, charged={}, numLesson={}, totalMoney={}",
                    courseId, date, transition.getRecord().isAbsent(), transition.getRecord().isChargeMoney(),
                    transition.getLedger().getBalance().getNumLesson(),
                    transition.getLedger().getBalance().getTotalMoney());
            return new AttendanceResult(studentId, transition.getRecord(),
                transition.getLedger().getBalance(), true);
        });
    }

    /**
     * Attendance records of a student ordered by date, then course.
     */
    @Transactional(readOnly = true)
    public List<AttendanceRecord> getAttendance(Long studentId) {
        return read("getAttendance", studentId, () -> loadStudent(studentId).toLedger().chronologicalRecords());
    }

    @Transactional(readOnly = true)
    public StudentLedger getStudentLedger(Long studentId) {
        return read("getStudentLedger", studentId, () -> loadStudent(studentId).toLedger());
    }

    // ==================== Enrollment ====================

    /**
     * Enrolls a student in a course; the enrollment date starts monthly billing.
     *
     * @param enrollmentDate defaults to today
     * @throws com.flagship.school_billing.billing.exception.ConflictException if already enrolled
     */
    public Enrollment enrollCourse(Long studentId, Long courseId, LocalDate enrollmentDate) {
        return write("enrollCourse", studentId, () -> {
            lockStudent(studentId);
            loadCourse(courseId);
            LocalDate effectiveDate = enrollmentDate != null ? enrollmentDate : today();
            Enrollment enrollment = enrollmentService.enroll(studentId, courseId, effectiveDate);
            metrics.recordEnrollment();
            log.info("Student enrolled: course={}, enrollmentDate={}", courseId, effectiveDate);
            return enrollment;
        });
    }

    /**
     * Adds to the course-scoped attended-lessons counter. The student's
     * billed lesson count is not touched.
     */
    public Enrollment addLessonsAttended(Long studentId, Long courseId, int count) {
        return write("addLessonsAttended", studentId, () -> {
            lockStudent(studentId);
            Enrollment enrollment = enrollmentService.addLessonsAttended(studentId, courseId, count);
            log.info("Added {} lessons for course {}, now {}", count, courseId, enrollment.getLessonsAttended());
            return enrollment;
        });
    }

    // ==================== Payments ====================

    /**
     * Appends a payment, credits it to the student's running balance and
     * returns the refreshed debt.
     *
     * @param paymentDate defaults to today
     * @param description defaults to {@value Payment#DEFAULT_DESCRIPTION}
     */
    public PaymentReceipt recordPayment(Long studentId, Long courseId, BigDecimal amount,
                                        LocalDate paymentDate, String description) {
        return write("recordPayment", studentId, () -> {
            LocalDate today = today();
            Payment payment = Payment.record(studentId, courseId, amount,
                paymentDate != null ? paymentDate : today, description);
            StudentEntity student = lockStudent(studentId);
            loadCourse(courseId);

            Payment saved = paymentLedger.append(payment);
            StudentLedger credited = student.toLedger().credit(saved.getAmount());
            student.applyLedger(credited);
            studentRepository.saveAndFlush(student);

            DebtReport debt = debtCalculationService.monthlyDebt(studentId, today);
            metrics.recordPayment(saved.getAmount());
            log.info("Payment recorded: paymentId={}, course={}, amount={}, balance={}, owesMoney={}",
                    saved.getId(), courseId, saved.getAmount(), debt.getBalance(), debt.isOwesMoney());
            return new PaymentReceipt(saved, credited.getBalance(), debt);
        });
    }

    @Transactional(readOnly = true)
    public List<Payment> getPayments(Long studentId) {
        return read("getPayments", studentId, () -> {
            loadStudent(studentId);
            return paymentLedger.findByStudent(studentId);
        });
    }

    // ==================== Debt ====================

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public DebtReport computeMonthlyDebt(Long studentId) {
        return read("computeMonthlyDebt", studentId,
            () -> debtCalculationService.monthlyDebt(studentId, today()));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AggregateDebtReport computeMonthlySummary() {
        return read("computeMonthlySummary", null,
            () -> debtCalculationService.monthlySummary(today()));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CourseDebtReport computeCourseDebt(Long courseId) {
        return read("computeCourseDebt", null,
            () -> debtCalculationService.courseDebt(courseId, today()));
    }

    // ==================== Statistics ====================

    /**
     * Sum of all running balances, payments of the current month and student count.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public BillingStatistics computeStatistics() {
        return read("computeStatistics", null,
            () -> statisticsService.statistics(YearMonth.from(today())));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public MonthlyPaymentTotals computeMonthlyStatistics(int year) {
        return read("computeMonthlyStatistics", null, () -> statisticsService.monthlyStatistics(year));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<CoursePaymentTotal> computePaymentsByCourse() {
        return read("computePaymentsByCourse", null, statisticsService::paymentsByCourse);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public StudentPaymentSummary computeStudentPaymentSummary(Long studentId) {
        return read("computeStudentPaymentSummary", studentId, () -> {
            loadStudent(studentId);
            return statisticsService.studentPaymentSummary(studentId);
        });
    }

    // ==================== Helpers ====================

    private <T> T write(String operation, Long studentId, Supplier<T> work) {
        return observe(operation, studentId, () -> writeExecutor.execute(operation, studentId, work));
    }

    private <T> T read(String operation, Long studentId, Supplier<T> work) {
        return observe(operation, studentId, work);
    }

    private <T> T observe(String operation, Long studentId, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(OPERATION_MDC_KEY, operation);
        if (studentId != null) {
            MDC.put(STUDENT_ID_MDC_KEY, studentId.toString());
        }
        try {
            return work.get();
        } catch (BillingException e) {
            metrics.recordFailure(operation, e.getClass().getSimpleName());
            log.warn("{} failed: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordFailure(operation, "unexpected");
            log.error("{} failed unexpectedly", operation, e);
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(OPERATION_MDC_KEY);
            MDC.remove(STUDENT_ID_MDC_KEY);
        }
    }

    private StudentEntity lockStudent(Long studentId) {
        if (studentId == null) {
            throw new InvalidInputException("Student id is required");
        }
        return studentRepository.findByIdForUpdate(studentId)
            .orElseThrow(() -> NotFoundException.student(studentId));
    }

    private StudentEntity loadStudent(Long studentId) {
        if (studentId == null) {
            throw new InvalidInputException("Student id is required");
        }
        return studentRepository.findById(studentId)
            .orElseThrow(() -> NotFoundException.student(studentId));
    }

    private Course loadCourse(Long courseId) {
        if (courseId == null) {
            throw new InvalidInputException("Course id is required");
        }
        return courseRepository.findById(courseId)
            .map(CourseEntity::toDomain)
            .orElseThrow(() -> NotFoundException.course(courseId));
    }

    private static void requireDate(LocalDate date, String field) {
        if (date == null) {
            throw new InvalidInputException(field + " is required");
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
