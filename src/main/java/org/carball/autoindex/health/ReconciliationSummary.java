package org.carball.autoindex.health;

public record ReconciliationSummary(int orphansApplied, int orphansFailed, int leftoversDropped, int stillRunning) {

    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, 0, 0);
    }

    public int total() {
        return orphansApplied + orphansFailed + leftoversDropped;
    }
}
