package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.batch.duration} Timer (tags: target, mode)</li>
 *   <li>{@code reconciliation.batch.rows} DistributionSummary</li>
 *   <li>{@code reconciliation.rows} Counter (tags: target, outcome)</li>
 *   <li>{@code reconciliation.reference.auto_created} Counter (tag: entityType)</li>
 *   <li>{@code reconciliation.conflicts} Counter (tag: severity)</li>
 *   <li>{@code reconciliation.batch.aborted} Counter (tag: target)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("reconciliation.batch.rows")
                .description("Number of input rows per import batch")
                .register(registry);
    }

    @Override
    public void recordBatchDuration(String target, String mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(target + ":" + mode, k ->
                Timer.builder("reconciliation.batch.duration")
                        .description("Duration of import batches, preload to report")
                        .tag("target", target)
                        .tag("mode", mode)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int rows) {
        batchSizeSummary.record(rows);
    }

    @Override
    public void incrementRowOutcome(String target, String outcome) {
        counter("rows:" + target + ":" + outcome, () ->
                Counter.builder("reconciliation.rows")
                        .description("Import rows by outcome")
                        .tag("target", target)
                        .tag("outcome", outcome)
                        .register(registry)).increment();
    }

    @Override
    public void incrementReferenceAutoCreated(EntityType type) {
        counter("auto:" + type.name(), () ->
                Counter.builder("reconciliation.reference.auto_created")
                        .description("Reference entities created because no match existed")
                        .tag("entityType", type.getLabel())
                        .register(registry)).increment();
    }

    @Override
    public void incrementConflictDetected(String severity) {
        counter("conflict:" + severity, () ->
                Counter.builder("reconciliation.conflicts")
                        .description("Date range conflicts found while checking bookings")
                        .tag("severity", severity)
                        .register(registry)).increment();
    }

    @Override
    public void incrementBatchAborted(String target) {
        counter("aborted:" + target, () ->
                Counter.builder("reconciliation.batch.aborted")
                        .description("Import batches rolled back by an infrastructure failure")
                        .tag("target", target)
                        .register(registry)).increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
