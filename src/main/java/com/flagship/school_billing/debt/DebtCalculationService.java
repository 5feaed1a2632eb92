package com.flagship.school_billing.debt;

import com.flagship.school_billing.billing.exception.NotFoundException;
import com.flagship.school_billing.course.Course;
import com.flagship.school_billing.course.CourseEntity;
import com.flagship.school_billing.course.CourseRepository;
import com.flagship.school_billing.enrollment.Enrollment;
import com.flagship.school_billing.enrollment.EnrollmentEntity;
import com.flagship.school_billing.enrollment.EnrollmentRepository;
import com.flagship.school_billing.payment.PaymentLedger;
import com.flagship.school_billing.student.StudentEntity;
import com.flagship.school_billing.student.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads enrollments, courses and payment totals and hands them to
 * {@link DebtCalculator}. Never writes; transaction boundaries are set by the
 * caller so a report is computed from one consistent snapshot.
 */
@Service
@RequiredArgsConstructor
public class DebtCalculationService {

    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final PaymentLedger paymentLedger;
    private final DebtCalculator debtCalculator;

    public DebtReport monthlyDebt(Long studentId, LocalDate evaluationDate) {
        StudentEntity student = studentRepository.findById(studentId)
            .orElseThrow(() -> NotFoundException.student(studentId));
        return monthlyDebt(student, evaluationDate, paymentLedger.totalPaidByStudent(studentId), loadCourses());
    }

    public AggregateDebtReport monthlySummary(LocalDate evaluationDate) {
        Map<Long, Course> courses = loadCourses();
        Map<Long, BigDecimal> paid = paymentLedger.totalPaidPerStudent();
        Map<Long, List<EnrollmentEntity>> enrollmentsByStudent = enrollmentRepository
            .findAllByOrderByStudentIdAscCourseIdAsc().stream()
            .collect(Collectors.groupingBy(EnrollmentEntity::getStudentId));

        List<StudentDebtSummary> summaries = new ArrayList<>();
        for (StudentEntity student : studentRepository.findAllByOrderByIdAsc()) {
            List<EnrolledCourse> enrolled = toEnrolledCourses(
                enrollmentsByStudent.getOrDefault(student.getId(), List.of()), courses);
            DebtReport report = debtCalculator.monthlyDebt(
                student.getId(),
                student.getDisplayName(),
                enrolled,
                paid.getOrDefault(student.getId(), BigDecimal.ZERO),
                evaluationDate
            );
            summaries.add(debtCalculator.summarize(report));
        }
        return debtCalculator.aggregate(summaries, evaluationDate);
    }

    public CourseDebtReport courseDebt(Long courseId, LocalDate evaluationDate) {
        Course course = courseRepository.findById(courseId)
            .map(CourseEntity::toDomain)
            .orElseThrow(() -> NotFoundException.course(courseId));

        List<Enrollment> enrollments = enrollmentRepository.findByCourseIdOrderByStudentIdAsc(courseId).stream()
            .map(EnrollmentEntity::toDomain)
            .toList();
        Map<Long, String> names = new HashMap<>();
        studentRepository.findAllById(enrollments.stream().map(Enrollment::getStudentId).toList())
            .forEach(s -> names.put(s.getId(), s.getDisplayName()));

        return debtCalculator.courseDebt(course, enrollments, names,
            paymentLedger.totalPaidPerStudentForCourse(courseId), evaluationDate);
    }

    private DebtReport monthlyDebt(StudentEntity student, LocalDate evaluationDate,
                                   BigDecimal totalPaid, Map<Long, Course> courses) {
        List<EnrolledCourse> enrolled = toEnrolledCourses(
            enrollmentRepository.findByStudentIdOrderByCourseIdAsc(student.getId()), courses);
        return debtCalculator.monthlyDebt(student.getId(), student.getDisplayName(),
            enrolled, totalPaid, evaluationDate);
    }

    private List<EnrolledCourse> toEnrolledCourses(List<EnrollmentEntity> enrollments, Map<Long, Course> courses) {
        return enrollments.stream()
            .map(e -> {
                Course course = courses.get(e.getCourseId());
                if (course == null) {
                    throw new IllegalStateException(
                        "Enrollment " + e.getId() + " references missing course " + e.getCourseId());
                }
                return EnrolledCourse.of(e.toDomain(), course);
            })
            .toList();
    }

    private Map<Long, Course> loadCourses() {
        return courseRepository.findAll().stream()
            .map(CourseEntity::toDomain)
            .collect(Collectors.toMap(Course::getId, Function.identity()));
    }
}
