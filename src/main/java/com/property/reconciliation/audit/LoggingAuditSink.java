package com.property.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Audit sink that writes each entry as a structured log line. Suitable when
 * the log pipeline is the system of record for the audit trail.
 */
public class LoggingAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger("com.property.reconciliation.audit");

    @Override
    public void append(List<AuditEntry> entries) {
        for (AuditEntry entry : entries) {
            log.info("audit.entry id={} action={} entityType={} entityId={} actor={} summary=\"{}\"",
                    entry.id(), entry.action(), entry.entityType().getLabel(), entry.entityId(),
                    entry.actorId(), entry.summary());
        }
    }
}
