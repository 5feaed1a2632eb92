package com.flagship.school_billing.enrollment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA entity for the student_course_progress table.
 * One row per (student, course); the pair is unique in the schema.
 */
@Entity
@Table(
    name = "student_course_progress",
    uniqueConstraints = @UniqueConstraint(name = "uk_progress_student_course", columnNames = {"student_id", "course_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EnrollmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private Long studentId;

    @Column(name = "course_id", nullable = false, updatable = false)
    private Long courseId;

    @Column(name = "enrollment_date", nullable = false, updatable = false)
    private LocalDate enrollmentDate;

    @Column(name = "lessons_attended", nullable = false)
    private int lessonsAttended;

    public static EnrollmentEntity enroll(Long studentId, Long courseId, LocalDate enrollmentDate) {
        EnrollmentEntity entity = new EnrollmentEntity();
        entity.studentId = studentId;
        entity.courseId = courseId;
        entity.enrollmentDate = enrollmentDate;
        entity.lessonsAttended = 0;
        return entity;
    }

    void addLessons(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Lesson count cannot be negative: " + count);
        }
        this.lessonsAttended = Math.addExact(this.lessonsAttended, count);
    }

    public Enrollment toDomain() {
        return new Enrollment(id, studentId, courseId, enrollmentDate, lessonsAttended);
    }
}
