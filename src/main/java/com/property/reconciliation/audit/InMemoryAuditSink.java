package com.property.reconciliation.audit;

import com.property.reconciliation.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Audit sink that keeps every committed entry in memory.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(List<AuditEntry> batch) {
        entries.addAll(batch);
    }

    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> findByEntityId(String entityId) {
        return entries.stream()
                .filter(e -> entityId.equals(e.entityId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public List<AuditEntry> findByEntityType(EntityType type) {
        return entries.stream()
                .filter(e -> e.entityType() == type)
                .collect(Collectors.toList());
    }

    public int count() {
        return entries.size();
    }
}
