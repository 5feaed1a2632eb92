package com.flagship.school_billing.billing;

import com.flagship.school_billing.billing.exception.ConcurrencyConflictException;
import com.flagship.school_billing.observability.BillingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a billing write for one student in its own transaction, retrying on
 * concurrency failures.
 *
 * Each attempt is a fresh transaction: a failed attempt is rolled back in full
 * before the next one reloads the student, so no partial reversal or charge
 * ever survives. Optimistic version conflicts, lock timeouts and deadlocks all
 * surface as {@link ConcurrencyFailureException}; after
 * {@code billing.concurrency.max-attempts} of them the write fails with
 * {@link ConcurrencyConflictException}.
 */
@Component
@Slf4j
public class StudentWriteExecutor {

    private final TransactionTemplate transactionTemplate;
    private final BillingMetrics metrics;
    private final int maxAttempts;
    private final long backoffMs;

    public StudentWriteExecutor(PlatformTransactionManager transactionManager,
                                BillingMetrics metrics,
                                @Value("${billing.concurrency.max-attempts:3}") int maxAttempts,
                                @Value("${billing.concurrency.backoff-ms:50}") long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("billing.concurrency.max-attempts must be at least 1");
        }
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // each attempt gets its own transaction, even under a caller's
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
        this.backoffMs = Math.max(0, backoffMs);
    }

    public <T> T execute(String operation, Long studentId, Supplier<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                metrics.recordRetry(operation);
                if (attempt >= maxAttempts) {
                    throw new ConcurrencyConflictException(operation, studentId, attempt, e);
                }
                log.warn("Concurrent write on student {} during {} (attempt {}/{}): {}",
                        studentId, operation, attempt, maxAttempts, e.getMessage());
                pause(attempt, operation, studentId, e);
            }
        }
    }

    private void pause(int attempt, String operation, Long studentId, ConcurrencyFailureException cause) {
        if (backoffMs == 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException(operation, studentId, attempt, cause);
        }
    }
}
