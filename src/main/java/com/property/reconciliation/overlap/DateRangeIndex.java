package com.property.reconciliation.overlap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of existing ranges grouped by resource scope.
 * Built once per batch; ranges in different scopes never interact.
 * {@link #with} derives a new index rather than changing this one.
 */
public final class DateRangeIndex {

    private static final Comparator<ScheduledRange> BY_DATES =
            Comparator.comparing((ScheduledRange r) -> r.range().start()).thenComparing(r -> r.range().end());

    private static final DateRangeIndex EMPTY = new DateRangeIndex(Map.of());

    private final Map<String, List<ScheduledRange>> byScope;

    private DateRangeIndex(Map<String, List<ScheduledRange>> byScope) {
        this.byScope = byScope;
    }

    public static DateRangeIndex empty() {
        return EMPTY;
    }

    public static DateRangeIndex of(Collection<ScheduledRange> ranges) {
        Map<String, List<ScheduledRange>> grouped = new HashMap<>();
        for (ScheduledRange range : ranges) {
            grouped.computeIfAbsent(range.scopeId(), k -> new ArrayList<>()).add(range);
        }
        Map<String, List<ScheduledRange>> sorted = new HashMap<>();
        grouped.forEach((scope, list) -> {
            list.sort(BY_DATES);
            sorted.put(scope, List.copyOf(list));
        });
        return new DateRangeIndex(Map.copyOf(sorted));
    }

    /**
     * Copy of this index holding {@code range}, replacing any entry of the same
     * scope with the same entry id. Only the affected scope is re-sorted.
     */
    public DateRangeIndex with(ScheduledRange range) {
        List<ScheduledRange> list = new ArrayList<>();
        for (ScheduledRange existing : rangesFor(range.scopeId())) {
            if (!existing.entryId().equals(range.entryId())) {
                list.add(existing);
            }
        }
        list.add(range);
        list.sort(BY_DATES);
        Map<String, List<ScheduledRange>> copy = new HashMap<>(byScope);
        copy.put(range.scopeId(), List.copyOf(list));
        return new DateRangeIndex(Map.copyOf(copy));
    }

    /**
     * Ranges held for a scope, ordered by start date.
     */
    public List<ScheduledRange> rangesFor(String scopeId) {
        return byScope.getOrDefault(scopeId, List.of());
    }

    public int scopeCount() {
        return byScope.size();
    }

    public int size() {
        return byScope.values().stream().mapToInt(List::size).sum();
    }
}
