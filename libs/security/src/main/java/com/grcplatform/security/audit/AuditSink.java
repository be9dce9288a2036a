package com.grcplatform.security.audit;

import com.grcplatform.auditmodel.ChainedAuditRecord;

/**
 * Durable destination for audit records. Called from a single writer thread, in chain order.
 */
public interface AuditSink {

    /**
     * Persists one record. Any exception is treated as a write failure.
     */
    void write(ChainedAuditRecord record);
}
