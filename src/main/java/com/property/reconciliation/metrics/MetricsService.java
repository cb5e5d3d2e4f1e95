package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordBatchDuration(String target, String mode, Duration duration);

    void recordBatchSize(int rows);

    void incrementRowOutcome(String target, String outcome);

    void incrementReferenceAutoCreated(EntityType type);

    /**
     * @param severity how the conflict was treated: {@code warning}, {@code error}, {@code rejected},
     *                 {@code skipped}, or {@code updated} when an import replaced the overlapped record
     */
    void incrementConflictDetected(String severity);

    void incrementBatchAborted(String target);
}
