package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBatchDuration(String target, String mode, Duration duration) {
    }

    @Override
    public void recordBatchSize(int rows) {
    }

    @Override
    public void incrementRowOutcome(String target, String outcome) {
    }

    @Override
    public void incrementReferenceAutoCreated(EntityType type) {
    }

    @Override
    public void incrementConflictDetected(String severity) {
    }

    @Override
    public void incrementBatchAborted(String target) {
    }
}
