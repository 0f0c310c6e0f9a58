package org.carball.autoindex.safety;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryApprovalQueue implements ApprovalQueue {

    private final Map<UUID, PendingApproval> pending = new ConcurrentHashMap<>();

    @Override
    public void submit(PendingApproval approval) {
        pending.put(approval.decision().decisionId(), approval);
    }

    @Override
    public Optional<PendingApproval> take(UUID decisionId) {
        return Optional.ofNullable(pending.remove(decisionId));
    }

    @Override
    public List<PendingApproval> pending() {
        return pending.values().stream()
                .sorted(Comparator.comparing(PendingApproval::requestedAt))
                .toList();
    }

    @Override
    public int size() {
        return pending.size();
    }
}
