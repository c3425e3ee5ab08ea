package com.synthgov.core.audit;

import java.util.List;

/**
 * Destination for evaluation audit records.
 * Implementations: InMemory (dev/testing) or anything backed by durable
 * storage in the host application.
 */
public interface AuditSink {

    /**
     * Store one record. Called on the caller's thread after every evaluation,
     * so it should be quick.
     */
    void record(AuditRecord record);

    /**
     * Most recent records, newest last.
     */
    List<AuditRecord> recent(int limit);
}
