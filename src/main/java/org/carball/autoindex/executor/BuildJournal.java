package org.carball.autoindex.executor;

import java.util.List;
import java.util.UUID;

public interface BuildJournal {

    void begin(BuildJournalEntry entry);

    void markNeedsCleanup(UUID decisionId, String detail);

    /**
     * Removes the entry; the build is fully accounted for.
     */
    void complete(UUID decisionId);

    List<BuildJournalEntry> openEntries();
}
