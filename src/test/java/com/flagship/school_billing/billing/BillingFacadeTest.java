package com.flagship.school_billing.billing;

import com.flagship.school_billing.attendance.AttendancePatch;
import com.flagship.school_billing.attendance.AttendanceRecord;
import com.flagship.school_billing.attendance.StudentLedger;
import com.flagship.school_billing.billing.exception.ConflictException;
import com.flagship.school_billing.billing.exception.InvalidInputException;
import com.flagship.school_billing.billing.exception.NotFoundException;
import com.flagship.school_billing.course.CourseEntity;
import com.flagship.school_billing.course.CourseRepository;
import com.flagship.school_billing.debt.AggregateDebtReport;
import com.flagship.school_billing.debt.CourseDebtReport;
import com.flagship.school_billing.debt.CourseStudentDebt;
import com.flagship.school_billing.debt.DebtReport;
import com.flagship.school_billing.debt.StudentDebtSummary;
import com.flagship.school_billing.enrollment.Enrollment;
import com.flagship.school_billing.payment.CoursePaymentTotal;
import com.flagship.school_billing.payment.Payment;
import com.flagship.school_billing.stats.BillingStatistics;
import com.flagship.school_billing.stats.MonthlyPaymentTotals;
import com.flagship.school_billing.stats.StudentPaymentSummary;
import com.flagship.school_billing.student.StudentEntity;
import com.flagship.school_billing.student.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Billing facade against a real PostgreSQL.
 *
 * Verifies that:
 * - attendance writes keep num_lesson and total_money consistent with the stored records
 * - failed writes leave no partial state behind
 * - concurrent writes for one student never lose a charge
 * - debt reports reflect enrollments and payments as of the fixed clock
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class BillingFacadeTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);
    private static final LocalDate DAY_1 = LocalDate.of(2026, 3, 2);
    private static final LocalDate DAY_2 = LocalDate.of(2026, 3, 4);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("school_billing_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private BillingFacade billingFacade;

    @Autowired
    private StudentRepository studentRepository;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long studentId;
    private Long englishId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE payments, student_course_progress, student_attendance, students, courses "
                + "RESTART IDENTITY CASCADE");
        studentId = createStudent("Ada", "Lovelace");
        englishId = createCourse("English B1", "160", 8);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printBalance(String label, StudentLedger ledger) {
        System.out.println(label + ": numLesson=" + ledger.getBalance().getNumLesson()
                + ", totalMoney=" + ledger.getBalance().getTotalMoney());
    }

    private Long createStudent(String name, String surname) {
        return studentRepository.save(StudentEntity.register(name, surname, null, TODAY)).getId();
    }

    private Long createCourse(String name, String cost, int lessonPerMonth) {
        return courseRepository.save(CourseEntity.create(name, new BigDecimal(cost), lessonPerMonth)).getId();
    }

    private void assertBalance(int numLesson, String totalMoney) {
        StudentLedger ledger = billingFacade.getStudentLedger(studentId);
        assertEquals(numLesson, ledger.getBalance().getNumLesson(), "numLesson");
        assertEquals(0, new BigDecimal(totalMoney).compareTo(ledger.getBalance().getTotalMoney()),
                "totalMoney was " + ledger.getBalance().getTotalMoney());
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "was " + actual);
    }

    // ========================================================================
    // ATTENDANCE
    // ========================================================================

    @Nested
    @DisplayName("1. Attendance")
    class AttendanceTests {

        @Test
        @DisplayName("1.1 Present, absent charged, then excused keeps one lesson and one charge")
        void testAttendanceScenario() {
            printTestHeader("Attendance Scenario");

            billingFacade.recordAttendance(studentId, englishId, DAY_1);
            assertBalance(1, "-20");

            billingFacade.recordAttendance(studentId, englishId, DAY_2, true, true, "no show");
            assertBalance(1, "-40");

            AttendanceResult result = billingFacade.updateAttendance(studentId, englishId, DAY_2,
                    AttendancePatch.builder().chargeMoney(false).build());
            printBalance("After update", billingFacade.getStudentLedger(studentId));

            assertTrue(result.getRecord().isAbsent());
            assertFalse(result.getRecord().isChargeMoney());
            assertEquals("no show", result.getRecord().getReason());
            assertBalance(1, "-20");
        }

        @Test
        @DisplayName("1.2 Recording the same key twice overwrites with reversal")
        void testRecordAttendance_Overwrite() {
            printTestHeader("Record Attendance - Overwrite");

            billingFacade.recordAttendance(studentId, englishId, DAY_1);
            AttendanceResult second = billingFacade.recordAttendance(studentId, englishId, DAY_1, true, false, "sick");

            assertTrue(second.isReplacedExisting());
            List<AttendanceRecord> records = billingFacade.getAttendance(studentId);
            assertEquals(1, records.size());
            assertTrue(records.get(0).isAbsent());
            assertBalance(0, "0");
        }

        @Test
        @DisplayName("1.3 Attendance is listed by date, then course")
        void testGetAttendance_Ordered() {
            Long germanId = createCourse("German A2", "100", 3);

            billingFacade.recordAttendance(studentId, englishId, DAY_2);
            billingFacade.recordAttendance(studentId, germanId, DAY_1);
            billingFacade.recordAttendance(studentId, englishId, DAY_1);

            List<AttendanceRecord> records = billingFacade.getAttendance(studentId);

            assertEquals(3, records.size());
            assertEquals(DAY_1, records.get(0).getDate());
            assertEquals(englishId, records.get(0).getCourseId());
            assertEquals(germanId, records.get(1).getCourseId());
            assertEquals(DAY_2, records.get(2).getDate());
        }

        @Test
        @DisplayName("1.4 Non-terminating lesson cost reverses back to exactly zero")
        void testUpdateAttendance_NonTerminatingCost() {
            Long germanId = createCourse("German A2", "100", 3);

            billingFacade.recordAttendance(studentId, germanId, DAY_1);
            billingFacade.updateAttendance(studentId, germanId, DAY_1,
                    AttendancePatch.builder().absent(true).chargeMoney(false).build());

            assertBalance(0, "0");
        }

        @Test
        @DisplayName("1.5 Update reverses at the current course price")
        void testUpdateAttendance_CurrentPrice() {
            billingFacade.recordAttendance(studentId, englishId, DAY_1);

            CourseEntity english = courseRepository.findById(englishId).orElseThrow();
            english.reprice(new BigDecimal("200"), 8);
            courseRepository.save(english);

            billingFacade.updateAttendance(studentId, englishId, DAY_1,
                    AttendancePatch.builder().chargeMoney(false).build());

            assertBalance(0, "5");
        }

        @Test
        @DisplayName("1.6 Updating a missing record fails and changes nothing")
        void testUpdateAttendance_NotFound() {
            printTestHeader("Update Attendance - Not Found");
            billingFacade.recordAttendance(studentId, englishId, DAY_1);

            assertThrows(NotFoundException.class, () -> billingFacade.updateAttendance(studentId, englishId, DAY_2,
                    AttendancePatch.builder().absent(true).build()));

            assertBalance(1, "-20");
            assertEquals(1, billingFacade.getAttendance(studentId).size());
        }

        @Test
        @DisplayName("1.7 Unknown student or course is not found, missing date is invalid")
        void testRecordAttendance_Rejected() {
            assertThrows(NotFoundException.class, () -> billingFacade.recordAttendance(999L, englishId, DAY_1));
            assertThrows(NotFoundException.class, () -> billingFacade.recordAttendance(studentId, 999L, DAY_1));
            assertThrows(InvalidInputException.class, () -> billingFacade.recordAttendance(studentId, englishId, null));
            assertThrows(NotFoundException.class, () -> billingFacade.getAttendance(999L));

            assertBalance(0, "0");
            assertTrue(billingFacade.getAttendance(studentId).isEmpty());
        }

        @Test
        @DisplayName("1.8 Over-long reason is invalid input and leaves the record untouched")
        void testAttendance_ReasonTooLong() {
            billingFacade.recordAttendance(studentId, englishId, DAY_1);
            String reason = "x".repeat(AttendanceRecord.MAX_REASON_LENGTH + 100);

            assertThrows(InvalidInputException.class,
                    () -> billingFacade.recordAttendance(studentId, englishId, DAY_2, true, true, reason));
            assertThrows(InvalidInputException.class, () -> billingFacade.updateAttendance(studentId, englishId,
                    DAY_1, AttendancePatch.builder().absent(true).reason(reason).build()));

            List<AttendanceRecord> records = billingFacade.getAttendance(studentId);
            assertEquals(1, records.size());
            assertFalse(records.get(0).isAbsent());
            assertBalance(1, "-20");
        }
    }

    // ========================================================================
    // ENROLLMENT
    // ========================================================================

    @Nested
    @DisplayName("2. Enrollment")
    class EnrollmentTests {

        @Test
        @DisplayName("2.1 Enrollment date defaults to today")
        void testEnroll_DefaultsToToday() {
            Enrollment enrollment = billingFacade.enrollCourse(studentId, englishId, null);

            assertEquals(TODAY, enrollment.getEnrollmentDate());
            assertEquals(0, enrollment.getLessonsAttended());
        }

        @Test
        @DisplayName("2.2 Enrolling twice is a conflict")
        void testEnroll_Duplicate() {
            billingFacade.enrollCourse(studentId, englishId, LocalDate.of(2026, 1, 10));

            assertThrows(ConflictException.class,
                    () -> billingFacade.enrollCourse(studentId, englishId, TODAY));
        }

        @Test
        @DisplayName("2.3 Lessons attended counter is separate from the billed lesson count")
        void testAddLessonsAttended() {
            billingFacade.enrollCourse(studentId, englishId, TODAY);
            billingFacade.recordAttendance(studentId, englishId, DAY_1);

            Enrollment enrollment = billingFacade.addLessonsAttended(studentId, englishId, 3);
            enrollment = billingFacade.addLessonsAttended(studentId, englishId, 2);

            assertEquals(5, enrollment.getLessonsAttended());
            assertBalance(1, "-20");
        }

        @Test
        @DisplayName("2.4 Negative counts are invalid, unknown enrollments are not found")
        void testAddLessonsAttended_Rejected() {
            billingFacade.enrollCourse(studentId, englishId, TODAY);
            Long germanId = createCourse("German A2", "100", 3);

            assertThrows(InvalidInputException.class,
                    () -> billingFacade.addLessonsAttended(studentId, englishId, -1));
            assertThrows(NotFoundException.class,
                    () -> billingFacade.addLessonsAttended(studentId, germanId, 1));
        }
    }

    // ========================================================================
    // PAYMENTS AND DEBT
    // ========================================================================

    @Nested
    @DisplayName("3. Payments and debt")
    class DebtTests {

        @Test
        @DisplayName("3.1 Payment credits the balance and returns the refreshed debt")
        void testRecordPayment_Receipt() {
            printTestHeader("Record Payment - Receipt");
            billingFacade.enrollCourse(studentId, englishId, LocalDate.of(2026, 1, 15));
            billingFacade.recordAttendance(studentId, englishId, DAY_1);

            PaymentReceipt receipt = billingFacade.recordPayment(studentId, englishId,
                    new BigDecimal("100.00"), null, null);

            assertEquals(Payment.DEFAULT_DESCRIPTION, receipt.getPayment().getDescription());
            assertEquals(TODAY, receipt.getPayment().getPaymentDate());
            assertNotNull(receipt.getPayment().getId());
            assertAmount("80", receipt.getBalance().getTotalMoney());

            DebtReport debt = receipt.getDebt();
            assertAmount("320", debt.getTotalMonthlyOwed());
            assertAmount("100", debt.getTotalPaid());
            assertAmount("-220", debt.getBalance());
            assertTrue(debt.isOwesMoney());
            assertEquals("Ada Lovelace", debt.getStudentName());
            assertEquals(1, billingFacade.getPayments(studentId).size());
        }

        @Test
        @DisplayName("3.2 Non-positive payments are invalid and nothing is stored")
        void testRecordPayment_Invalid() {
            assertThrows(InvalidInputException.class, () -> billingFacade.recordPayment(studentId, englishId,
                    new BigDecimal("-5"), TODAY, "refund"));
            assertThrows(InvalidInputException.class, () -> billingFacade.recordPayment(studentId, englishId,
                    BigDecimal.ZERO, TODAY, "nothing"));

            assertThrows(InvalidInputException.class, () -> billingFacade.recordPayment(studentId, englishId,
                    new BigDecimal("10"), TODAY, "y".repeat(Payment.MAX_DESCRIPTION_LENGTH + 100)));

            assertTrue(billingFacade.getPayments(studentId).isEmpty());
            assertBalance(0, "0");
        }

        @Test
        @DisplayName("3.3 Student enrolled today owes one month")
        void testMonthlyDebt_EnrolledToday() {
            billingFacade.enrollCourse(studentId, englishId, TODAY);

            DebtReport debt = billingFacade.computeMonthlyDebt(studentId);

            assertEquals(1, debt.getCourseBreakdown().get(0).getMonthsEnrolled());
            assertAmount("160", debt.getDebtAmount());
            assertThrows(NotFoundException.class, () -> billingFacade.computeMonthlyDebt(999L));
        }

        @Test
        @DisplayName("3.4 Summary covers every student")
        void testMonthlySummary() {
            Long payer = createStudent("Alan", "Turing");
            billingFacade.enrollCourse(studentId, englishId, TODAY);
            billingFacade.enrollCourse(payer, englishId, TODAY);
            billingFacade.recordPayment(payer, englishId, new BigDecimal("200"), TODAY, null);

            AggregateDebtReport summary = billingFacade.computeMonthlySummary();

            assertEquals(2, summary.getStudents().size());
            assertEquals(1, summary.getStudentsWithDebt());
            assertAmount("160", summary.getTotalDebtAllStudents());
            StudentDebtSummary alan = summary.getStudents().stream()
                    .filter(s -> s.getStudentId().equals(payer)).findFirst().orElseThrow();
            assertAmount("40", alan.getBalance());
            assertFalse(alan.hasDebt());
        }

        @Test
        @DisplayName("3.5 Course debt counts only payments for that course")
        void testCourseDebt() {
            Long germanId = createCourse("German A2", "100", 3);
            billingFacade.enrollCourse(studentId, englishId, TODAY);
            billingFacade.enrollCourse(studentId, germanId, TODAY);
            billingFacade.recordPayment(studentId, germanId, new BigDecimal("100"), TODAY, null);

            CourseDebtReport report = billingFacade.computeCourseDebt(englishId);

            assertEquals(1, report.getStudents().size());
            CourseStudentDebt line = report.getStudents().get(0);
            assertAmount("0", line.getCoursePayments());
            assertAmount("160", line.getDebt());
            assertAmount("160", report.getTotalCourseDebt());
            assertThrows(NotFoundException.class, () -> billingFacade.computeCourseDebt(999L));
        }
    }

    // ========================================================================
    // STATISTICS
    // ========================================================================

    @Nested
    @DisplayName("5. Statistics")
    class StatisticsTests {

        private Long alanId;
        private Long germanId;

        @BeforeEach
        void recordPayments() {
            alanId = createStudent("Alan", "Turing");
            germanId = createCourse("German A2", "100", 3);
            billingFacade.recordAttendance(studentId, englishId, DAY_1);
            billingFacade.recordPayment(studentId, englishId, new BigDecimal("100"), DAY_1, null);
            billingFacade.recordPayment(studentId, germanId, new BigDecimal("50"), LocalDate.of(2026, 1, 10), null);
            billingFacade.recordPayment(alanId, englishId, new BigDecimal("30"), LocalDate.of(2025, 12, 20), null);
        }

        @Test
        @DisplayName("5.1 Overview sums running balances and this month's payments")
        void testStatistics() {
            printTestHeader("Statistics - Overview");

            BillingStatistics statistics = billingFacade.computeStatistics();

            assertEquals(YearMonth.of(2026, 3), statistics.getMonth());
            assertAmount("160", statistics.getTotalMoney());
            assertAmount("100", statistics.getMonthlyMoney());
            assertEquals(2, statistics.getTotalStudents());
        }

        @Test
        @DisplayName("5.2 Monthly totals cover all twelve months of the requested year")
        void testMonthlyStatistics() {
            MonthlyPaymentTotals year2026 = billingFacade.computeMonthlyStatistics(2026);
            MonthlyPaymentTotals year2025 = billingFacade.computeMonthlyStatistics(2025);

            assertEquals(12, year2026.getByMonth().size());
            assertAmount("50", year2026.getByMonth().get(1));
            assertAmount("0", year2026.getByMonth().get(2));
            assertAmount("100", year2026.getByMonth().get(3));
            assertAmount("150", year2026.total());
            assertAmount("30", year2025.getByMonth().get(12));
            assertAmount("30", year2025.total());
            assertThrows(InvalidInputException.class, () -> billingFacade.computeMonthlyStatistics(0));
        }

        @Test
        @DisplayName("5.3 Payments are totalled per course, ordered by course name")
        void testPaymentsByCourse() {
            List<CoursePaymentTotal> totals = billingFacade.computePaymentsByCourse();

            assertEquals(2, totals.size());
            assertEquals("English B1", totals.get(0).getCourseName());
            assertAmount("130", totals.get(0).getTotalAmount());
            assertEquals(germanId, totals.get(1).getCourseId());
            assertAmount("50", totals.get(1).getTotalAmount());
        }

        @Test
        @DisplayName("5.4 Student summary separates payments from attendance charges")
        void testStudentPaymentSummary() {
            StudentPaymentSummary summary = billingFacade.computeStudentPaymentSummary(studentId);

            assertAmount("150", summary.getTotalPaid());
            assertAmount("130", summary.getRunningBalance());
            assertAmount("-20", summary.getAttendanceBalance());
            assertThrows(NotFoundException.class, () -> billingFacade.computeStudentPaymentSummary(999L));
        }
    }

    // ========================================================================
    // CONCURRENCY
    // ========================================================================

    @Nested
    @DisplayName("4. Concurrent writes")
    class ConcurrencyTests {

        @Test
        @DisplayName("4.1 Concurrent attendance for one student never loses a charge")
        void testConcurrentAttendance_NoLostCharges() throws Exception {
            printTestHeader("Concurrent Attendance - No Lost Charges");
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AttendanceResult>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                LocalDate date = DAY_1.plusDays(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return billingFacade.recordAttendance(studentId, englishId, date);
                }));
            }
            start.countDown();
            for (Future<AttendanceResult> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            printBalance("After concurrent writes", billingFacade.getStudentLedger(studentId));
            assertEquals(threads, billingFacade.getAttendance(studentId).size());
            assertBalance(threads, "-160");
        }

        @Test
        @DisplayName("4.2 Concurrent toggles of one record keep the balance consistent with its final state")
        void testConcurrentUpdates_ConsistentBalance() throws Exception {
            billingFacade.recordAttendance(studentId, englishId, DAY_1);
            int threads = 6;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AttendanceResult>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                boolean absent = i % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    return billingFacade.updateAttendance(studentId, englishId, DAY_1,
                            AttendancePatch.builder().absent(absent).chargeMoney(!absent).build());
                }));
            }
            start.countDown();
            for (Future<AttendanceResult> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            AttendanceRecord last = billingFacade.getAttendance(studentId).get(0);
            if (last.isAbsent()) {
                assertBalance(0, "0");
            } else {
                assertBalance(1, "-20");
            }
        }
    }
}
