package com.flagship.school_billing.course;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA entity for the courses table.
 *
 * Course CRUD lives outside the billing core; this mapping only exposes what
 * billing reads, plus controlled factory/reprice methods for the admin layer.
 */
@Entity
@Table(name = "courses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal cost;

    @Column(name = "lesson_per_month", nullable = false)
    private int lessonPerMonth;

    public static CourseEntity create(String name, BigDecimal cost, int lessonPerMonth) {
        CourseEntity entity = new CourseEntity();
        entity.name = name;
        entity.reprice(cost, lessonPerMonth);
        return entity;
    }

    /**
     * Changes billing parameters. Past charges are not recomputed.
     */
    public void reprice(BigDecimal cost, int lessonPerMonth) {
        if (cost == null || cost.signum() < 0) {
            throw new IllegalArgumentException("Course cost must be zero or positive");
        }
        if (lessonPerMonth <= 0) {
            throw new IllegalArgumentException("lesson_per_month must be positive");
        }
        this.cost = cost;
        this.lessonPerMonth = lessonPerMonth;
    }

    public Course toDomain() {
        return new Course(id, name, cost, lessonPerMonth);
    }
}
