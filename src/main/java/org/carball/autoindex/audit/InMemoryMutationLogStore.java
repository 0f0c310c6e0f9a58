package org.carball.autoindex.audit;

import org.carball.autoindex.model.audit.MutationLogEntry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryMutationLogStore implements MutationLogStore {

    private final List<MutationLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(MutationLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<MutationLogEntry> readAll() {
        return List.copyOf(entries);
    }
}
