package com.property.reconciliation.benchmark;

import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.DateRangeIndex;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.overlap.ScheduledRange;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks comparing overlap detection against a property-scoped index
 * with a scan over every booking in the calendar.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class OverlapDetectorBenchmark {

    private static final LocalDate SEASON_START = LocalDate.of(2024, 1, 1);

    @Param({"100", "1000"})
    private int propertyCount;

    @Param({"20"})
    private int bookingsPerProperty;

    private List<ScheduledRange> bookings;
    private DateRangeIndex index;
    private OverlapDetector detector;
    private int queryCounter;

    @Setup(Level.Trial)
    public void setUp() {
        detector = new OverlapDetector();
        bookings = new ArrayList<>(propertyCount * bookingsPerProperty);
        for (int p = 0; p < propertyCount; p++) {
            for (int b = 0; b < bookingsPerProperty; b++) {
                LocalDate start = SEASON_START.plusDays(b * 10L);
                bookings.add(new ScheduledRange("b-" + p + "-" + b, "p-" + p,
                        DateRange.of(start, start.plusDays(7)), "CONFIRMED", "Guest " + b));
            }
        }
        index = DateRangeIndex.of(bookings);
        queryCounter = 0;
    }

    @Benchmark
    public void indexedDetect(Blackhole bh) {
        int n = queryCounter++;
        DateRange candidate = candidate(n);
        bh.consume(detector.detect(candidate, "p-" + (n % propertyCount), index));
    }

    /**
     * Baseline: filters the whole calendar by property before checking dates.
     */
    @Benchmark
    public void fullScanDetect(Blackhole bh) {
        int n = queryCounter++;
        DateRange candidate = candidate(n);
        String propertyId = "p-" + (n % propertyCount);
        List<ScheduledRange> conflicts = new ArrayList<>();
        for (ScheduledRange booking : bookings) {
            if (booking.scopeId().equals(propertyId) && booking.range().overlaps(candidate)) {
                conflicts.add(booking);
            }
        }
        bh.consume(conflicts);
    }

    @Benchmark
    public void buildIndex(Blackhole bh) {
        bh.consume(DateRangeIndex.of(bookings));
    }

    private DateRange candidate(int n) {
        LocalDate start = SEASON_START.plusDays(n % (bookingsPerProperty * 10L));
        return DateRange.of(start, start.plusDays(5));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(OverlapDetectorBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
