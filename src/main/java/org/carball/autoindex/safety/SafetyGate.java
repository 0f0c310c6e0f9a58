package org.carball.autoindex.safety;

import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.model.audit.MutationOutcome;
import org.carball.autoindex.model.decision.Decision;
import org.carball.autoindex.model.decision.DecisionAction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks every CREATE in a fixed order: bypass, in-flight duplicate,
 * maintenance window, rate limit, then approval. The first check that fails
 * decides the outcome. A rate-limit token is spent before the approval check,
 * so held builds count against the window they were proposed in.
 * <p>
 * Outside the maintenance window a build is deferred only when the window
 * opens within the configured wait; a window further away than that would
 * starve the key, so the build goes ahead.
 */
@Slf4j
public class SafetyGate {

    public static final String DUPLICATE_IN_FLIGHT = "duplicate in-flight build";

    private final BypassSwitch bypassSwitch;
    private final boolean advisoryMode;
    private final InFlightRegistry inFlightRegistry;
    private final TokenBucketRateLimiter rateLimiter;
    private final ApprovalQueue approvalQueue;
    private final boolean requireApproval;
    private final MaintenanceWindow maintenanceWindow;
    private final Duration maxWindowWait;
    private final Clock clock;

    public SafetyGate(BypassSwitch bypassSwitch, boolean advisoryMode, InFlightRegistry inFlightRegistry,
                      TokenBucketRateLimiter rateLimiter, ApprovalQueue approvalQueue,
                      boolean requireApproval, Clock clock) {
        this(bypassSwitch, advisoryMode, inFlightRegistry, rateLimiter, approvalQueue, requireApproval,
                null, Duration.ZERO, clock);
    }

    public SafetyGate(BypassSwitch bypassSwitch, boolean advisoryMode, InFlightRegistry inFlightRegistry,
                      TokenBucketRateLimiter rateLimiter, ApprovalQueue approvalQueue,
                      boolean requireApproval, MaintenanceWindow maintenanceWindow, Duration maxWindowWait,
                      Clock clock) {
        this.bypassSwitch = bypassSwitch;
        this.advisoryMode = advisoryMode;
        this.inFlightRegistry = inFlightRegistry;
        this.rateLimiter = rateLimiter;
        this.approvalQueue = approvalQueue;
        this.requireApproval = requireApproval;
        this.maintenanceWindow = maintenanceWindow;
        this.maxWindowWait = maxWindowWait == null ? Duration.ZERO : maxWindowWait;
        this.clock = clock;
    }

    public GateVerdict admit(Decision decision) {
        if (decision.action() != DecisionAction.CREATE) {
            throw new IllegalArgumentException("Only CREATE decisions pass the gate, got " + decision.action());
        }

        String bypassReason = bypassReason();
        if (bypassReason != null) {
            return GateVerdict.vetoed(decision, MutationOutcome.BYPASSED, bypassReason);
        }

        Optional<InFlightRegistry.Lease> lease = inFlightRegistry.tryAcquire(decision.key());
        if (lease.isEmpty()) {
            log.debug("Build for {} already in flight", decision.key());
            return GateVerdict.vetoed(decision.withAction(DecisionAction.SKIP, DUPLICATE_IN_FLIGHT),
                    MutationOutcome.SKIPPED, DUPLICATE_IN_FLIGHT);
        }

        String windowReason = outsideWindowReason(clock.instant());
        if (windowReason != null) {
            lease.get().close();
            log.debug("Build of {} deferred: {}", decision.key(), windowReason);
            return GateVerdict.vetoed(decision.withAction(DecisionAction.DEFER, windowReason),
                    MutationOutcome.SKIPPED, windowReason);
        }

        if (!rateLimiter.tryAcquire(decision.tenantId())) {
            lease.get().close();
            String reason = "rate limit reached for tenant " + decision.tenantId();
            return GateVerdict.vetoed(decision.withAction(DecisionAction.DEFER, reason),
                    MutationOutcome.RATE_LIMITED, reason);
        }

        if (requireApproval) {
            lease.get().close();
            approvalQueue.submit(new PendingApproval(decision, clock.instant()));
            String reason = "awaiting operator approval";
            log.info("Build of {} held for approval (decision {})", decision.key(), decision.decisionId());
            return GateVerdict.vetoed(decision.withAction(DecisionAction.DEFER, reason),
                    MutationOutcome.PENDING_APPROVAL, reason);
        }

        return GateVerdict.admitted(decision, lease.get());
    }

    private String outsideWindowReason(Instant now) {
        if (maintenanceWindow == null || maintenanceWindow.isOpen(now)) {
            return null;
        }
        Duration wait = maintenanceWindow.timeUntilOpen(now);
        if (wait.compareTo(maxWindowWait) > 0) {
            log.debug("Maintenance window {} opens in {}, beyond the {} wait; not deferring",
                    maintenanceWindow, wait, maxWindowWait);
            return null;
        }
        return String.format(Locale.ROOT, "outside maintenance window %s (opens in %.1fh)",
                maintenanceWindow, wait.toMinutes() / 60.0);
    }

    /**
     * Non-null when no mutation may run right now.
     */
    public String bypassReason() {
        if (advisoryMode) {
            return "advisory mode";
        }
        if (bypassSwitch.isEnabled()) {
            return "bypass enabled: " + bypassSwitch.getReason();
        }
        return null;
    }
}
