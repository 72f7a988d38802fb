package quota.java.engine;

import quota.core.model.KeyContract;
import quota.core.usage.UsageLog;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Usage log of one key together with the lock that guards it.
 *
 * The log is tied to the generation of the contract it was built under; when the
 * registry holds a newer generation the log belongs to a replaced registration and
 * is discarded.
 *
 * Every method except {@link #getLock()} MUST be called while holding the lock.
 */
final class UsageEntry {

    private static final long NO_GENERATION = -1L;

    private final ReentrantLock lock = new ReentrantLock(); // Non-fair for better throughput
    private final UsageLog log = new UsageLog();
    private long generation = NO_GENERATION;

    ReentrantLock getLock() {
        return lock;
    }

    UsageLog getLog() {
        return log;
    }

    /**
     * Aligns the log with the given contract.
     *
     * @return true if a log from an older registration was discarded
     */
    boolean bindTo(KeyContract contract) {
        if (generation == contract.generation()) {
            return false;
        }
        boolean discarded = generation != NO_GENERATION && !log.isEmpty();
        log.clear();
        generation = contract.generation();
        return discarded;
    }
}
