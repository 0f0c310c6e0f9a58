package org.carball.autoindex.executor;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBuildJournal implements BuildJournal {

    private final Map<UUID, BuildJournalEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void begin(BuildJournalEntry entry) {
        entries.put(entry.decisionId(), entry);
    }

    @Override
    public void markNeedsCleanup(UUID decisionId, String detail) {
        entries.computeIfPresent(decisionId, (id, e) -> e.withStatus(BuildJournalEntry.Status.NEEDS_CLEANUP, detail));
    }

    @Override
    public void complete(UUID decisionId) {
        entries.remove(decisionId);
    }

    @Override
    public List<BuildJournalEntry> openEntries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(BuildJournalEntry::startedAt))
                .toList();
    }
}
