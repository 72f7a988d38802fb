package quota.core.model;

/**
 * Result of evaluating one use request.
 *
 * @param decision ADMITTED, DENIED or NOT_FOUND
 * @param usageLeft uses still available in the current window, excluding an admitted one (0 when denied)
 * @param msUntilReset milliseconds until the oldest logged use ages out (0 when the log is empty)
 */
public record UsageResult(
    Decision decision,
    int usageLeft,
    long msUntilReset
) {
    public static UsageResult admitted(int usageLeft, long msUntilReset) {
        return new UsageResult(Decision.ADMITTED, Math.max(0, usageLeft), Math.max(0L, msUntilReset));
    }

    public static UsageResult denied(long msUntilReset) {
        return new UsageResult(Decision.DENIED, 0, Math.max(0L, msUntilReset));
    }

    public static UsageResult notFound() {
        return new UsageResult(Decision.NOT_FOUND, 0, 0L);
    }

    public boolean isAdmitted() {
        return decision == Decision.ADMITTED;
    }
}
