package com.property.reconciliation.audit;

import java.util.List;

/**
 * Write-only destination of the audit trail. The store calls it once per
 * committed transaction with the entries buffered by that transaction, in
 * the order they were appended.
 */
public interface AuditSink {

    void append(List<AuditEntry> entries);
}
