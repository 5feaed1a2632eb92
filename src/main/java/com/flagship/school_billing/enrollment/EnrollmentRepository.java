package com.flagship.school_billing.enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EnrollmentRepository extends JpaRepository<EnrollmentEntity, Long> {

    Optional<EnrollmentEntity> findByStudentIdAndCourseId(Long studentId, Long courseId);

    boolean existsByStudentIdAndCourseId(Long studentId, Long courseId);

    List<EnrollmentEntity> findByStudentIdOrderByCourseIdAsc(Long studentId);

    List<EnrollmentEntity> findByCourseIdOrderByStudentIdAsc(Long courseId);

    List<EnrollmentEntity> findAllByOrderByStudentIdAscCourseIdAsc();
}
