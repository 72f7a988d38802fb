package quota.core.usage;

import quota.core.model.KeyContract;
import quota.core.model.UsageResult;

import java.util.ArrayDeque;

/**
 * Exact sliding window (log) of admitted uses for one key.
 *
 * Stores the timestamp of every admitted use, oldest first. Each evaluation evicts
 * expired timestamps from the front, then admits if fewer than {@code limit} remain.
 *
 * Pros: exact count over any trailing window, no boundary double counting.
 * Cons: O(limit) memory per key; eviction is amortized O(1) per use.
 *
 * Thread-safety: none. The owner must hold the key's lock around every call.
 */
public final class UsageLog {

    private final ArrayDeque<Long> events = new ArrayDeque<>();

    /**
     * Evicts expired uses, then admits and records {@code now} if the contract allows it.
     *
     * <p>A {@code now} older than the newest recorded use is treated as that newest use,
     * so the log stays ordered when callers read the clock before taking the key's lock.
     *
     * @param now evaluation time in milliseconds
     * @param contract limit and window of the key
     * @return ADMITTED or DENIED with remaining usage and time until the next slot frees up
     */
    public UsageResult tryRecord(long now, KeyContract contract) {
        long at = events.isEmpty() ? now : Math.max(now, events.peekLast());
        long windowMillis = contract.windowMillis();
        evictExpired(at, windowMillis);

        int count = events.size();
        if (count < contract.limit()) {
            events.addLast(at);
            return UsageResult.admitted(contract.limit() - count - 1, msUntilReset(at, windowMillis));
        }
        return UsageResult.denied(msUntilReset(at, windowMillis));
    }

    /**
     * Removes, oldest first, every use with {@code now - t > windowMillis}.
     * Stops at the first survivor since the log is time ordered.
     *
     * @return number of evicted uses
     */
    public int evictExpired(long now, long windowMillis) {
        int evicted = 0;
        while (!events.isEmpty() && now - events.peekFirst() > windowMillis) {
            events.removeFirst();
            evicted++;
        }
        return evicted;
    }

    /**
     * Milliseconds until the oldest surviving use ages out; 0 for an empty log.
     * A use aged exactly one window still holds its slot, so a non-empty log reports at least 1.
     */
    public long msUntilReset(long now, long windowMillis) {
        if (events.isEmpty()) {
            return 0L;
        }
        long oldest = events.peekFirst();
        return Math.max(1L, windowMillis - (now - oldest));
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public void clear() {
        events.clear();
    }
}
