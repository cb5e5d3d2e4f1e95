package com.property.reconciliation.bulk;

import com.property.reconciliation.logging.LogContext;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.reference.DestinationCountryLookup;
import com.property.reconciliation.reference.ReferenceResolver;
import com.property.reconciliation.store.ConstraintViolationException;
import com.property.reconciliation.store.StoreException;
import com.property.reconciliation.store.TransactionalStore;
import com.property.reconciliation.tracing.NoOpTracingService;
import com.property.reconciliation.tracing.Span;
import com.property.reconciliation.tracing.TracingService;
import com.property.reconciliation.validation.ImportRow;
import com.property.reconciliation.validation.RowValidator;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a bulk import of one sheet as a single transaction.
 *
 * <p>The batch first preloads every record rows may refer to, then processes
 * the rows in sequential chunks. Rows inside a chunk run concurrently on a
 * fixed worker pool, unless the sheet's handler asks for sequential
 * processing. Row-level problems are collected into the {@link ImportReport}
 * and the batch carries on; a store failure on any row, or a chunk that does
 * not finish within the row timeout, rolls back the whole batch.</p>
 *
 * <p>The reconciler owns its worker pool and must be closed.</p>
 */
public class BatchReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchReconciler.class);

    private final TransactionalStore store;
    private final ImportOptions defaultOptions;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final BatchContextLoader loader = new BatchContextLoader();
    private final Map<ImportTarget, RowHandler> handlers = new EnumMap<>(ImportTarget.class);
    private final ExecutorService executor;

    public BatchReconciler(TransactionalStore store, ImportOptions defaultOptions) {
        this(store, new RowValidator(), null, new OverlapDetector(), new EntityWriter(), defaultOptions,
                new NoOpMetricsService(), new NoOpTracingService());
    }

    /**
     * @param resolver resolver to use, or null to build one on the given writer
     */
    public BatchReconciler(TransactionalStore store, RowValidator validator, ReferenceResolver resolver,
                           OverlapDetector detector, EntityWriter writer, ImportOptions defaultOptions,
                           MetricsService metricsService, TracingService tracingService) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.defaultOptions = defaultOptions != null ? defaultOptions : ImportOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
        ReferenceResolver references = resolver != null
                ? resolver
                : new ReferenceResolver(writer, DestinationCountryLookup.standard(), this.metricsService);

        register(new PropertyRowHandler(validator, references, writer));
        register(new BookingRowHandler(validator, references, writer, detector, this.metricsService));
        register(new ContactRowHandler(validator, references, writer));
        register(new CombinedRowHandler(validator, references, writer, detector, this.metricsService));
        register(new PriceRangeRowHandler(validator, references, writer, detector, this.metricsService));

        this.executor = Executors.newFixedThreadPool(Math.max(1, this.defaultOptions.getChunkSize()),
                new WorkerThreadFactory());
        log.info("reconciler.initialized options={}", this.defaultOptions);
    }

    private void register(RowHandler handler) {
        handlers.put(handler.target(), handler);
    }

    public ImportReport reconcile(List<ImportRow> rows, ImportTarget target, ImportMode mode, String actorId) {
        return reconcile(rows, target, mode, actorId, defaultOptions, ProgressCallback.NOOP);
    }

    /**
     * Entry point for callers holding the mode as text, such as an upload form.
     * An unsupported mode yields an aborted report rather than an exception.
     */
    public ImportReport reconcile(List<ImportRow> rows, ImportTarget target, String mode, String actorId,
                                  ImportOptions options, ProgressCallback callback) {
        ImportMode parsed;
        try {
            parsed = ImportMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            log.warn("import.rejected target={} reason={}", target, e.getMessage());
            return ImportReport.aborted(LogContext.generateBatchId(), target, null,
                    rows != null ? rows.size() : 0, e.getMessage());
        }
        return reconcile(rows, target, parsed, actorId, options, callback);
    }

    public ImportReport reconcile(List<ImportRow> rows, ImportTarget target, ImportMode mode, String actorId,
                                  ImportOptions options, ProgressCallback callback) {
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(mode, "mode is required");
        ImportOptions opts = options != null ? options : defaultOptions;
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportRow> input = rows != null ? List.copyOf(rows) : List.of();
        String batchId = LogContext.generateBatchId();

        try (LogContext ctx = LogContext.forBatch(batchId, target.getLabel(), mode.getLabel());
             Span span = tracingService.startSpan("reconciliation.batch",
                     Map.of("target", target.getLabel(), "mode", mode.getLabel()))) {
            span.setAttribute("rows", input.size());
            if (input.isEmpty()) {
                log.info("import.empty");
                return ImportReport.empty(batchId, target, mode);
            }
            if (input.size() > opts.getMaxRows()) {
                log.warn("import.rejected rows={} maxRows={}", input.size(), opts.getMaxRows());
                return ImportReport.aborted(batchId, target, mode, input.size(),
                        "Import has " + input.size() + " rows; the limit is " + opts.getMaxRows());
            }

            log.info("import.started rows={} chunkSize={}", input.size(), opts.getChunkSize());
            metricsService.recordBatchSize(input.size());
            long startNanos = System.nanoTime();
            RowHandler handler = handlers.get(target);
            ImportReport report;
            try {
                List<RowOutcome> outcomes = store.inTransaction(tx -> {
                    BatchContext context = loader.load(tx, batchId, target, mode, opts, actorId);
                    handler.prepare(input, context);
                    return processChunks(input, handler, context, opts, cb, span);
                });
                for (RowOutcome outcome : outcomes) {
                    metricsService.incrementRowOutcome(target.getLabel(), outcome.kind());
                }
                report = ImportReport.from(batchId, target, mode, input.size(), outcomes);
                cb.onProgress(input.size(), input.size(), "Import completed");
                log.info("import.completed report={}", report);
            } catch (StoreException | BatchAbortedException e) {
                span.markFailed(e);
                metricsService.incrementBatchAborted(target.getLabel());
                report = ImportReport.aborted(batchId, target, mode, input.size(), abortMessage(e));
                log.error("import.aborted rows={} reason={}", input.size(), report.errors().get(0).message());
            }
            metricsService.recordBatchDuration(target.getLabel(), mode.getLabel(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            return report;
        }
    }

    private List<RowOutcome> processChunks(List<ImportRow> rows, RowHandler handler, BatchContext context,
                                           ImportOptions options, ProgressCallback callback, Span batchSpan) {
        int chunkSize = options.getChunkSize();
        int chunkCount = (rows.size() + chunkSize - 1) / chunkSize;
        List<RowOutcome> outcomes = new ArrayList<>(rows.size());

        for (int chunk = 0; chunk < chunkCount; chunk++) {
            List<ImportRow> slice = rows.subList(chunk * chunkSize, Math.min(rows.size(), (chunk + 1) * chunkSize));
            try (Span span = tracingService.startSpan("reconciliation.chunk",
                    Map.of("chunk", Integer.toString(chunk + 1)))) {
                span.setAttribute("rows", slice.size());
                List<RowOutcome> chunkOutcomes = handler.concurrent()
                        ? runConcurrently(slice, handler, context, options.getRowTimeoutMillis())
                        : runSequentially(slice, handler, context);
                for (RowOutcome outcome : chunkOutcomes) {
                    if (outcome instanceof RowOutcome.Fatal fatal) {
                        span.markFailed(fatal.cause());
                        throw new BatchAbortedException(fatal.rowNumber(), "Import aborted at row "
                                + fatal.rowNumber() + ": " + fatal.cause().getMessage(), fatal.cause());
                    }
                }
                outcomes.addAll(chunkOutcomes);
            }
            log.debug("import.chunk_processed chunk={} of={} rows={}", chunk + 1, chunkCount, slice.size());
            callback.onProgress(outcomes.size(), rows.size(), "Processed chunk " + (chunk + 1) + " of " + chunkCount);
        }
        batchSpan.addEvent("rows.processed");
        return outcomes;
    }

    private List<RowOutcome> runSequentially(List<ImportRow> slice, RowHandler handler, BatchContext context) {
        Map<String, String> mdc = LogContext.capture();
        List<RowOutcome> outcomes = new ArrayList<>(slice.size());
        for (ImportRow row : slice) {
            RowOutcome outcome = process(handler, row, context, mdc);
            outcomes.add(outcome);
            if (outcome instanceof RowOutcome.Fatal) {
                break;
            }
        }
        return outcomes;
    }

    private List<RowOutcome> runConcurrently(List<ImportRow> slice, RowHandler handler, BatchContext context,
                                             long timeoutMillis) {
        Map<String, String> mdc = LogContext.capture();
        List<CompletableFuture<RowOutcome>> futures = new ArrayList<>(slice.size());
        for (ImportRow row : slice) {
            futures.add(CompletableFuture.supplyAsync(() -> process(handler, row, context, mdc), executor));
        }
        int firstRow = slice.get(0).rowNumber();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            futures.forEach(future -> future.cancel(true));
            throw new BatchAbortedException(firstRow, "Import aborted: rows starting at row " + firstRow
                    + " did not finish within " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new BatchAbortedException(firstRow, "Import interrupted", e);
        } catch (ExecutionException e) {
            throw new BatchAbortedException(firstRow, "Import aborted: " + e.getCause().getMessage(), e.getCause());
        }

        List<RowOutcome> outcomes = new ArrayList<>(slice.size());
        for (CompletableFuture<RowOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    /**
     * Runs one row and classifies anything it throws: store failures are
     * fatal to the batch, constraint violations and other errors fail the row.
     */
    private RowOutcome process(RowHandler handler, ImportRow row, BatchContext context, Map<String, String> mdc) {
        try (LogContext ctx = LogContext.forRow(mdc, row.rowNumber())) {
            try {
                return handler.handle(row, context);
            } catch (StoreException e) {
                log.error("import.row_fatal error={}", e.getMessage());
                return new RowOutcome.Fatal(row.rowNumber(), e);
            } catch (ConstraintViolationException e) {
                log.warn("import.row_constraint constraint={} error={}", e.getConstraint(), e.getMessage());
                return RowOutcome.Failed.of(row.rowNumber(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("import.row_error error={}", e.getMessage(), e);
                return RowOutcome.Failed.of(row.rowNumber(), "Unexpected error: " + e.getMessage());
            }
        }
    }

    private static String abortMessage(RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof BatchAbortedException) {
                return current.getMessage();
            }
            current = current.getCause();
        }
        return "Import aborted: " + e.getMessage();
    }

    public ImportOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "reconciliation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
