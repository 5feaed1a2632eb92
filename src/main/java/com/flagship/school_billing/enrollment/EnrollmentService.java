package com.flagship.school_billing.enrollment;

import com.flagship.school_billing.billing.exception.ConflictException;
import com.flagship.school_billing.billing.exception.InvalidInputException;
import com.flagship.school_billing.billing.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Enrollment writes. Callers are expected to hold the student's lock, which
 * makes the duplicate check race-free; the unique constraint is the backstop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment enroll(Long studentId, Long courseId, LocalDate enrollmentDate) {
        if (enrollmentDate == null) {
            throw new InvalidInputException("Enrollment date is required");
        }
        if (enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)) {
            throw new ConflictException(
                String.format("Student %s is already enrolled in course %s", studentId, courseId));
        }
        try {
            EnrollmentEntity saved = enrollmentRepository.saveAndFlush(
                EnrollmentEntity.enroll(studentId, courseId, enrollmentDate));
            log.debug("Enrolled student {} in course {} from {}", studentId, courseId, enrollmentDate);
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(
                String.format("Student %s is already enrolled in course %s", studentId, courseId), e);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment addLessonsAttended(Long studentId, Long courseId, int count) {
        if (count < 0) {
            throw new InvalidInputException("Lessons count cannot be negative: " + count);
        }
        EnrollmentEntity entity = enrollmentRepository.findByStudentIdAndCourseId(studentId, courseId)
            .orElseThrow(() -> NotFoundException.enrollment(studentId, courseId));
        entity.addLessons(count);
        return enrollmentRepository.save(entity).toDomain();
    }
}
