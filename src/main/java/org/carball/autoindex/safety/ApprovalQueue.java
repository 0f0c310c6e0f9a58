package org.carball.autoindex.safety;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ApprovalQueue {

    void submit(PendingApproval approval);

    /**
     * Removes and returns the pending approval, so each one is resolved once.
     */
    Optional<PendingApproval> take(UUID decisionId);

    List<PendingApproval> pending();

    int size();
}
