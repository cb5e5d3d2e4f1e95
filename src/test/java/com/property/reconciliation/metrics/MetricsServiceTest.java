package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBatchDuration("bookings", "create", Duration.ofMillis(100));
                noOp.recordBatchSize(50);
                noOp.incrementRowOutcome("bookings", "created");
                noOp.incrementReferenceAutoCreated(EntityType.DESTINATION);
                noOp.incrementConflictDetected("warning");
                noOp.incrementBatchAborted("bookings");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record batch duration per target and mode")
        void recordBatchDuration() {
            metrics.recordBatchDuration("properties", "create", Duration.ofMillis(150));
            metrics.recordBatchDuration("properties", "create", Duration.ofMillis(250));
            metrics.recordBatchDuration("properties", "update", Duration.ofMillis(10));

            Timer timer = registry.find("reconciliation.batch.duration")
                    .tag("target", "properties")
                    .tag("mode", "create")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        }

        @Test
        @DisplayName("Should summarise batch sizes")
        void recordBatchSize() {
            metrics.recordBatchSize(25);
            metrics.recordBatchSize(75);

            DistributionSummary summary = registry.find("reconciliation.batch.rows").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(100.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count rows by target and outcome")
        void incrementRowOutcome() {
            metrics.incrementRowOutcome("bookings", "created");
            metrics.incrementRowOutcome("bookings", "created");
            metrics.incrementRowOutcome("bookings", "failed");

            Counter created = registry.find("reconciliation.rows")
                    .tag("target", "bookings")
                    .tag("outcome", "created")
                    .counter();
            Counter failed = registry.find("reconciliation.rows")
                    .tag("outcome", "failed")
                    .counter();

            assertNotNull(created);
            assertEquals(2.0, created.count());
            assertNotNull(failed);
            assertEquals(1.0, failed.count());
        }

        @Test
        @DisplayName("Should count auto-created references by entity label")
        void incrementReferenceAutoCreated() {
            metrics.incrementReferenceAutoCreated(EntityType.DESTINATION);

            Counter counter = registry.find("reconciliation.reference.auto_created")
                    .tag("entityType", "destination")
                    .counter();

            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count conflicts by severity and aborted batches by target")
        void conflictsAndAborts() {
            metrics.incrementConflictDetected("warning");
            metrics.incrementConflictDetected("rejected");
            metrics.incrementConflictDetected("rejected");
            metrics.incrementBatchAborted("contacts");

            assertEquals(1.0, registry.find("reconciliation.conflicts").tag("severity", "warning")
                    .counter().count());
            assertEquals(2.0, registry.find("reconciliation.conflicts").tag("severity", "rejected")
                    .counter().count());
            assertEquals(1.0, registry.find("reconciliation.batch.aborted").tag("target", "contacts")
                    .counter().count());
        }
    }
}
