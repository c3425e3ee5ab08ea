package com.synthgov.core.audit;

import com.synthgov.core.GovernanceConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory implementation of AuditSink for development and single-instance
 * deployments. Keeps only the most recent {@code capacity} records.
 */
public class InMemoryAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditSink.class);

    private final int capacity;
    private final Deque<AuditRecord> records = new ArrayDeque<>();

    public InMemoryAuditSink(int capacity) {
        if (capacity < 1) {
            throw new GovernanceConfigurationException("synthgov.audit.capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void record(AuditRecord record) {
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
        log.debug("[SynthGov] Audited {}", record);
    }

    @Override
    public synchronized List<AuditRecord> recent(int limit) {
        List<AuditRecord> all = new ArrayList<>(records);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return records.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
