package agentyard.coordinator.model;

import java.time.Instant;

/**
 * Outcome of one gateway reconciliation tick.
 *
 * @param skipped true when the tick did not run (previous tick still active or
 *                discovery/route listing failed)
 */
public record ReconcileReport(
        Instant startedAt,
        int discovered,
        int created,
        int updated,
        int deleted,
        int retained,
        int failed,
        int retired,
        boolean skipped,
        String abortReason) {

    public static ReconcileReport skipped(Instant startedAt, String reason) {
        return new ReconcileReport(startedAt, 0, 0, 0, 0, 0, 0, 0, true, reason);
    }

    public boolean converged() {
        return !skipped && failed == 0;
    }
}
