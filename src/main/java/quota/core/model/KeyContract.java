package quota.core.model;

import java.time.Duration;

/**
 * Quota contract registered for one key: at most {@code limit} uses in any trailing {@code window}.
 *
 * <p>Every registration write gets a distinct {@code generation}, so a usage log can tell
 * whether it was built under the contract currently registered for its key.
 *
 * <p>Inputs are normally validated before they get here; the checks below reject anything
 * that would otherwise admit without bound.
 *
 * @param key opaque tenant identifier
 * @param limit uses permitted per window, 1 &lt;= limit &lt; Integer.MAX_VALUE
 * @param window window length, at least one millisecond
 * @param generation registration stamp assigned by the registry
 */
public record KeyContract(
    String key,
    int limit,
    Duration window,
    long generation
) {
    public KeyContract {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        if (limit == Integer.MAX_VALUE) throw new IllegalArgumentException("limit must be < " + Integer.MAX_VALUE);
        if (window == null) throw new IllegalArgumentException("window cannot be null");
        if (window.isNegative() || toMillisOrMax(window) <= 0) {
            throw new IllegalArgumentException("window must be >= 1ms, got: " + window);
        }
        if (toMillisOrMax(window) == Long.MAX_VALUE) {
            throw new IllegalArgumentException("window must be finite, got: " + window);
        }
    }

    public long windowMillis() {
        return window.toMillis();
    }

    private static long toMillisOrMax(Duration window) {
        try {
            return window.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    // key left out so contracts can be logged
    @Override
    public String toString() {
        return "KeyContract{limit=" + limit + ", window=" + window + ", generation=" + generation + "}";
    }
}
