package com.flagship.school_billing.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for billing operations.
 *
 * Metrics exposed:
 * - billing.attendance.events: attendance writes, tagged by outcome and whether a lesson was charged
 * - billing.payments.recorded / billing.payments.amount: payment count and amounts
 * - billing.enrollments.created: new enrollments
 * - billing.write.retries: optimistic/lock conflicts that triggered a retry
 * - billing.operations.failed: failures by operation and error kind
 * - billing.operations.latency: operation timings
 */
@Component
public class BillingMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary paymentAmounts;

    public BillingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.paymentAmounts = DistributionSummary.builder("billing.payments.amount")
                .description("Amounts of recorded payments")
                .register(registry);
    }

    /**
     * @param outcome created, overwritten or updated
     */
    public void recordAttendanceEvent(String outcome, boolean charged) {
        registry.counter("billing.attendance.events",
                "outcome", sanitizeTag(outcome),
                "charged", String.valueOf(charged)
        ).increment();
    }

    public void recordPayment(BigDecimal amount) {
        registry.counter("billing.payments.recorded").increment();
        paymentAmounts.record(amount.doubleValue());
    }

    public void recordEnrollment() {
        registry.counter("billing.enrollments.created").increment();
    }

    public void recordRetry(String operation) {
        registry.counter("billing.write.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordFailure(String operation, String kind) {
        registry.counter("billing.operations.failed",
                "operation", sanitizeTag(operation),
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("billing.operations.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
