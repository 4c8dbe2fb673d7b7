package com.eainde.kyc.audit;

import java.util.List;

/**
 * Append-only store of every scored record. It is also the source of the history view.
 */
public interface AuditLog {

    /**
     * Durably appends one entry. Safe to call from concurrent threads.
     *
     * @throws com.eainde.kyc.exception.AuditPersistenceException if the entry was not written
     */
    void append(AuditEntry entry);

    /**
     * @return every readable entry, newest first; unreadable lines are skipped
     */
    List<AuditEntry> readAll();
}
