package org.carball.autoindex.audit;

import org.carball.autoindex.model.audit.MutationLogEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only system of record. An append is atomic: it either stores the
 * whole entry or throws {@link AuditWriteException}. Implementations are safe
 * for concurrent writers.
 */
public interface MutationLogStore {

    void append(MutationLogEntry entry);

    List<MutationLogEntry> readAll();

    default List<MutationLogEntry> entriesFor(UUID decisionId) {
        return readAll().stream()
                .filter(e -> e.decisionId().equals(decisionId))
                .sorted(Comparator.comparing(MutationLogEntry::recordedAt))
                .toList();
    }

    default Optional<MutationLogEntry> latestFor(UUID decisionId) {
        List<MutationLogEntry> entries = entriesFor(decisionId);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }
}
