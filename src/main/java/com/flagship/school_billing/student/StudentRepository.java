package com.flagship.school_billing.student;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Repository for students.
 */
@Repository
public interface StudentRepository extends JpaRepository<StudentEntity, Long> {

    /**
     * Loads a student with an exclusive row lock (SELECT ... FOR UPDATE).
     * Every billing write goes through here, which serializes writes per student.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StudentEntity s WHERE s.id = :id")
    Optional<StudentEntity> findByIdForUpdate(@Param("id") Long id);

    List<StudentEntity> findAllByOrderByIdAsc();

    /**
     * Sum of every student's running balance, or {@code null} when there are no students.
     */
    @Query("SELECT SUM(s.totalMoney) FROM StudentEntity s")
    BigDecimal sumTotalMoney();
}
