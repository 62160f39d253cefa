package com.smartcampus.security.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit store kept in memory. Used by tests and by local runs without a database.
 */
public final class InMemoryAuditStore implements AuditStore {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(AuditEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized long lastSequence() {
        return entries.stream().mapToLong(AuditEntry::sequence).max().orElse(0L);
    }

    /** Snapshot of the stored entries in append order. */
    public synchronized List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<AuditEntry> entriesFor(String principalId) {
        return entries.stream().filter(e -> principalId.equals(e.principalId())).toList();
    }

    public synchronized int size() {
        return entries.size();
    }
}
