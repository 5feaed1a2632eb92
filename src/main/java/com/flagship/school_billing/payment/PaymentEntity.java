package com.flagship.school_billing.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA Entity for Payment persistence.
 *
 * Every column is {@code updatable = false}: payments are append-only.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_student_id", columnList = "student_id"),
        @Index(name = "idx_payments_course_id", columnList = "course_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private Long studentId;

    @Column(name = "course_id", nullable = false, updatable = false)
    private Long courseId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Column(length = Payment.MAX_DESCRIPTION_LENGTH, updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            null,
            payment.getStudentId(),
            payment.getCourseId(),
            payment.getAmount(),
            payment.getPaymentDate(),
            payment.getDescription(),
            null // createdAt - set by @PrePersist
        );
    }

    public Payment toDomain() {
        return new Payment(id, studentId, courseId, amount, paymentDate, description);
    }
}
