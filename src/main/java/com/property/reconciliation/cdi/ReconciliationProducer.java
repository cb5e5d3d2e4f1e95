package com.property.reconciliation.cdi;

import com.property.reconciliation.audit.AuditSink;
import com.property.reconciliation.audit.InMemoryAuditSink;
import com.property.reconciliation.audit.LoggingAuditSink;
import com.property.reconciliation.booking.BookingService;
import com.property.reconciliation.bulk.BatchReconciler;
import com.property.reconciliation.bulk.ImportOptions;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.MicrometerMetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.overlap.AvailabilityAdvisor;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.reference.DestinationCountryLookup;
import com.property.reconciliation.reference.ReferenceResolver;
import com.property.reconciliation.store.InMemoryEntityStore;
import com.property.reconciliation.store.TransactionalStore;
import com.property.reconciliation.tracing.NoOpTracingService;
import com.property.reconciliation.tracing.OpenTelemetryTracingService;
import com.property.reconciliation.tracing.TracingService;
import com.property.reconciliation.validation.RowValidator;
import com.property.reconciliation.writer.EntityWriter;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the reconciliation engine from MicroProfile Config properties.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}; any of them
 * can be overridden by the hosting application:</p>
 * <pre>
 * reconciliation.import.chunk-size=10
 * reconciliation.import.auto-create-destinations=true
 * reconciliation.metrics.enabled=true
 * </pre>
 *
 * <p>Concrete classes without a no-arg constructor are produced as
 * {@link Singleton} since they cannot be proxied. Inject the produced beans directly:</p>
 * <pre>
 * &#64;Inject BatchReconciler reconciler;
 * &#64;Inject BookingService bookings;
 * </pre>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Import ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.import.chunk-size", defaultValue = "10")
    int chunkSize;

    @Inject
    @ConfigProperty(name = "reconciliation.import.max-rows", defaultValue = "10000")
    int maxRows;

    @Inject
    @ConfigProperty(name = "reconciliation.import.suggestion-limit", defaultValue = "3")
    int suggestionLimit;

    @Inject
    @ConfigProperty(name = "reconciliation.import.auto-create-destinations", defaultValue = "true")
    boolean autoCreateDestinations;

    @Inject
    @ConfigProperty(name = "reconciliation.import.auto-create-properties", defaultValue = "false")
    boolean autoCreateProperties;

    @Inject
    @ConfigProperty(name = "reconciliation.import.skip-duplicate-contacts", defaultValue = "false")
    boolean skipDuplicateContacts;

    @Inject
    @ConfigProperty(name = "reconciliation.import.skip-price-conflicts", defaultValue = "false")
    boolean skipPriceConflicts;

    @Inject
    @ConfigProperty(name = "reconciliation.import.default-country", defaultValue = "Unknown")
    String defaultCountry;

    @Inject
    @ConfigProperty(name = "reconciliation.import.row-timeout-millis", defaultValue = "30000")
    long rowTimeoutMillis;

    // ── Availability ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.availability.grace-period-days", defaultValue = "0")
    int gracePeriodDays;

    @Inject
    @ConfigProperty(name = "reconciliation.availability.max-alternatives", defaultValue = "5")
    int maxAlternatives;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "reconciliation.audit.sink", defaultValue = "logging")
    String auditSinkType;

    @Inject
    @ConfigProperty(name = "reconciliation.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "reconciliation.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    @ConfigProperty(name = "reconciliation.tracing.instrumentation-name", defaultValue = "property-reconciliation")
    String instrumentationName;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public ImportOptions importOptions() {
        ImportOptions options = ImportOptions.builder()
                .chunkSize(chunkSize)
                .maxRows(maxRows)
                .suggestionLimit(suggestionLimit)
                .autoCreateDestinations(autoCreateDestinations)
                .autoCreateProperties(autoCreateProperties)
                .skipDuplicateContacts(skipDuplicateContacts)
                .skipPriceConflicts(skipPriceConflicts)
                .defaultCountry(defaultCountry)
                .rowTimeoutMillis(rowTimeoutMillis)
                .gracePeriodDays(gracePeriodDays)
                .maxAlternativeSuggestions(maxAlternatives)
                .build();
        log.info("Import options: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public AuditSink auditSink() {
        if ("memory".equalsIgnoreCase(auditSinkType)) {
            return new InMemoryAuditSink();
        }
        if (!"logging".equalsIgnoreCase(auditSinkType)) {
            log.warn("Unknown audit sink '{}', falling back to logging", auditSinkType);
        }
        return new LoggingAuditSink();
    }

    @Produces
    @ApplicationScoped
    public TransactionalStore transactionalStore(AuditSink auditSink) {
        return new InMemoryEntityStore(auditSink);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled) {
            log.info("Metrics enabled: registry=global");
            return new MicrometerMetricsService(Metrics.globalRegistry);
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (tracingEnabled) {
            log.info("Tracing enabled: instrumentation={}", instrumentationName);
            return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(instrumentationName));
        }
        return new NoOpTracingService();
    }

    @Produces
    @Singleton
    public BatchReconciler batchReconciler(TransactionalStore store, ImportOptions options,
                                           MetricsService metricsService, TracingService tracingService) {
        EntityWriter writer = new EntityWriter();
        ReferenceResolver resolver = new ReferenceResolver(writer, DestinationCountryLookup.standard(),
                metricsService);
        return new BatchReconciler(store, new RowValidator(), resolver, new OverlapDetector(), writer, options,
                metricsService, tracingService);
    }

    public void closeReconciler(@Disposes BatchReconciler reconciler) {
        log.info("Closing BatchReconciler");
        reconciler.close();
    }

    @Produces
    @Singleton
    public BookingService bookingService(TransactionalStore store, ImportOptions options,
                                         MetricsService metricsService) {
        OverlapDetector detector = new OverlapDetector();
        return new BookingService(store, new EntityWriter(), detector,
                new AvailabilityAdvisor(detector, options.getMaxAlternativeSuggestions()), metricsService,
                options.getGracePeriodDays());
    }
}
