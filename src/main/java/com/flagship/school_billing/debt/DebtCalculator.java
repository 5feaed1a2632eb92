package com.flagship.school_billing.debt;

import com.flagship.school_billing.course.Course;
import com.flagship.school_billing.enrollment.Enrollment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Pure monthly-debt arithmetic.
 *
 * Every course is billed its full monthly cost for each whole month elapsed
 * since enrollment, with a minimum of one month. Sums are plain
 * {@link BigDecimal} additions, so results do not depend on iteration order,
 * and nothing is rounded.
 */
@Component
public class DebtCalculator {

    /**
     * Whole calendar months from {@code enrollmentDate} to {@code evaluationDate},
     * never less than one. An enrollment starting today (or in the future)
     * owes for the current month.
     */
    public static long monthsEnrolled(LocalDate enrollmentDate, LocalDate evaluationDate) {
        return Math.max(1L, ChronoUnit.MONTHS.between(enrollmentDate, evaluationDate));
    }

    public CourseDebtLine courseLine(EnrolledCourse enrolled, LocalDate evaluationDate) {
        Enrollment enrollment = enrolled.getEnrollment();
        Course course = enrolled.getCourse();
        long months = monthsEnrolled(enrollment.getEnrollmentDate(), evaluationDate);
        return CourseDebtLine.builder()
            .courseId(course.getId())
            .courseName(course.getName())
            .monthlyFee(course.getCost())
            .monthsEnrolled(months)
            .lessonsAttended(enrollment.getLessonsAttended())
            .expectedLessons(course.getLessonPerMonth() * months)
            .totalOwedForCourse(course.getCost().multiply(BigDecimal.valueOf(months)))
            .enrollmentDate(enrollment.getEnrollmentDate())
            .build();
    }

    public DebtReport monthlyDebt(Long studentId, String studentName, Collection<EnrolledCourse> enrollments,
                                  BigDecimal totalPaid, LocalDate evaluationDate) {
        List<CourseDebtLine> breakdown = new ArrayList<>(enrollments.size());
        BigDecimal totalOwed = BigDecimal.ZERO;
        for (EnrolledCourse enrolled : enrollments) {
            CourseDebtLine line = courseLine(enrolled, evaluationDate);
            breakdown.add(line);
            totalOwed = totalOwed.add(line.getTotalOwedForCourse());
        }

        BigDecimal balance = totalPaid.subtract(totalOwed);
        return DebtReport.builder()
            .studentId(studentId)
            .studentName(studentName)
            .evaluatedOn(evaluationDate)
            .courseBreakdown(List.copyOf(breakdown))
            .totalMonthlyOwed(totalOwed)
            .totalPaid(totalPaid)
            .balance(balance)
            .owesMoney(balance.signum() < 0)
            .debtAmount(debtOf(balance))
            .overpaidAmount(balance.max(BigDecimal.ZERO))
            .build();
    }

    public StudentDebtSummary summarize(DebtReport report) {
        return StudentDebtSummary.builder()
            .studentId(report.getStudentId())
            .studentName(report.getStudentName())
            .monthlyOwed(report.getTotalMonthlyOwed())
            .totalPaid(report.getTotalPaid())
            .debt(report.getDebtAmount())
            .balance(report.getBalance())
            .build();
    }

    public AggregateDebtReport aggregate(List<StudentDebtSummary> summaries, LocalDate evaluationDate) {
        BigDecimal totalDebt = summaries.stream()
            .map(StudentDebtSummary::getDebt)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        int withDebt = (int) summaries.stream().filter(StudentDebtSummary::hasDebt).count();
        return AggregateDebtReport.builder()
            .evaluatedOn(evaluationDate)
            .students(List.copyOf(summaries))
            .totalDebtAllStudents(totalDebt)
            .studentsWithDebt(withDebt)
            .build();
    }

    /**
     * Debt of every student enrolled in one course, counting only payments
     * recorded against that course.
     *
     * @param studentNames      display name per student id
     * @param paidPerStudent    course payments per student id; missing means nothing paid
     */
    public CourseDebtReport courseDebt(Course course, List<Enrollment> enrollments, Map<Long, String> studentNames,
                                       Map<Long, BigDecimal> paidPerStudent, LocalDate evaluationDate) {
        List<CourseStudentDebt> students = new ArrayList<>(enrollments.size());
        BigDecimal totalDebt = BigDecimal.ZERO;
        int withDebt = 0;

        for (Enrollment enrollment : enrollments) {
            CourseDebtLine line = courseLine(EnrolledCourse.of(enrollment, course), evaluationDate);
            BigDecimal paid = paidPerStudent.getOrDefault(enrollment.getStudentId(), BigDecimal.ZERO);
            BigDecimal balance = paid.subtract(line.getTotalOwedForCourse());
            BigDecimal debt = debtOf(balance);

            students.add(CourseStudentDebt.builder()
                .studentId(enrollment.getStudentId())
                .studentName(studentNames.get(enrollment.getStudentId()))
                .monthsEnrolled(line.getMonthsEnrolled())
                .lessonsAttended(line.getLessonsAttended())
                .expectedLessons(line.getExpectedLessons())
                .courseOwed(line.getTotalOwedForCourse())
                .coursePayments(paid)
                .balance(balance)
                .debt(debt)
                .build());

            totalDebt = totalDebt.add(debt);
            if (debt.signum() > 0) {
                withDebt++;
            }
        }

        return CourseDebtReport.builder()
            .courseId(course.getId())
            .courseName(course.getName())
            .monthlyFee(course.getCost())
            .evaluatedOn(evaluationDate)
            .students(List.copyOf(students))
            .totalCourseDebt(totalDebt)
            .studentsWithDebt(withDebt)
            .build();
    }

    private static BigDecimal debtOf(BigDecimal balance) {
        return balance.signum() < 0 ? balance.negate() : BigDecimal.ZERO;
    }
}
