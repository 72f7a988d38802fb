package quota.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quota.core.clock.Clock;
import quota.core.model.KeyContract;
import quota.core.model.RegistrationOutcome;
import quota.core.model.UsageResult;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe sliding window quota engine with multi-key support.
 *
 * Features:
 * - Contracts come from an injected {@link KeyRegistry}; unregistered keys are NOT_FOUND
 * - One exact usage log per key, created lazily on first use
 * - ReentrantLock per key: evict, decide and append run as one atomic step
 * - Forced re-registration discards the key's log under the same lock
 *
 * Architecture:
 * - ConcurrentHashMap stores UsageEntry (UsageLog + ReentrantLock + bound generation)
 * - Per-key locks eliminate a global bottleneck; different keys never block each other
 * - Clock injection enables deterministic testing
 *
 * Thread-safety:
 * - The contract is re-read under the key's lock, so a use never pairs one registration's
 *   contract with another registration's log
 * - Entries are never removed while the engine is open, so every thread locks the same entry
 *
 * Usage example:
 * <pre>
 * QuotaEngine engine = new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
 * engine.register("5f0c...", 100, Duration.ofMinutes(1), false);
 *
 * UsageResult result = engine.checkAndRecord("5f0c...");
 * if (result.decision() == Decision.ADMITTED) {
 *     // Process request
 * } else {
 *     // Back off for result.msUntilReset()
 * }
 * </pre>
 */
public final class QuotaEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(QuotaEngine.class);

    private final Clock clock;
    private final KeyRegistry registry;
    private final ConcurrentHashMap<String, UsageEntry> entries = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates a new quota engine.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param registry Registry holding the contract of every key
     * @throws IllegalArgumentException if any parameter is null
     */
    public QuotaEngine(Clock clock, KeyRegistry registry) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.clock = clock;
        this.registry = registry;
    }

    /**
     * Registers a key through the registry and, when an existing contract is overwritten,
     * discards the key's usage under its lock.
     *
     * @return CREATED, OVERWRITTEN or CONFLICT
     * @throws IllegalArgumentException if the contract is invalid
     */
    public RegistrationOutcome register(String key, int limit, Duration window, boolean force) {
        ensureOpen();
        RegistrationOutcome outcome = registry.register(key, limit, window, force);
        if (outcome == RegistrationOutcome.OVERWRITTEN) {
            resetUsage(key);
        }
        return outcome;
    }

    /**
     * Evaluates one use of a key at the current clock time.
     *
     * @see #checkAndRecord(String, long)
     */
    public UsageResult checkAndRecord(String key) {
        return checkAndRecord(key, clock.nowMillis());
    }

    /**
     * Evaluates one use of a key at time {@code nowMillis}.
     *
     * This method:
     * 1. Looks up the key's contract (NOT_FOUND without creating a log if absent)
     * 2. Acquires the per-key lock
     * 3. Discards the log if the contract was re-registered since it was built
     * 4. Evicts expired uses, admits and records if capacity remains
     * 5. Releases the lock
     *
     * Thread-safety: Safe for concurrent access from multiple threads.
     * Performance: Lock contention only occurs for the same key.
     *
     * @param key The key to charge
     * @param nowMillis Evaluation time in milliseconds
     * @return ADMITTED, DENIED or NOT_FOUND with usage left and time until reset
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if the engine is closed
     */
    public UsageResult checkAndRecord(String key, long nowMillis) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        ensureOpen();

        if (!registry.contains(key)) {
            return UsageResult.notFound();
        }

        UsageEntry entry = getOrCreateEntry(key);
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            Optional<KeyContract> contract = registry.lookup(key);
            if (contract.isEmpty()) {
                // registry cleared concurrently
                return UsageResult.notFound();
            }
            if (entry.bindTo(contract.get())) {
                LOG.debug("Discarded usage from a replaced registration, now {}", contract.get());
            }
            UsageResult result = entry.getLog().tryRecord(nowMillis, contract.get());
            LOG.trace("Use evaluated: {}", result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards the usage log of a key so it matches the currently registered contract.
     */
    private void resetUsage(String key) {
        UsageEntry entry = entries.get(key);
        if (entry == null) {
            return;
        }
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            registry.lookup(key).ifPresent(contract -> {
                if (entry.bindTo(contract)) {
                    LOG.debug("Reset usage after forced registration, now {}", contract);
                }
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retrieves or creates the usage entry for a key.
     *
     * putIfAbsent guarantees a single UsageEntry (and so a single lock) per key,
     * even when several threads see the key for the first time together.
     */
    private UsageEntry getOrCreateEntry(String key) {
        // Fast path: entry already exists
        UsageEntry entry = entries.get(key);
        if (entry != null) {
            return entry;
        }

        UsageEntry newEntry = new UsageEntry();
        UsageEntry existing = entries.putIfAbsent(key, newEntry);
        return (existing != null) ? existing : newEntry;
    }

    public KeyRegistry registry() {
        return registry;
    }

    /**
     * Returns the number of keys that have a usage log.
     */
    public int trackedKeys() {
        return entries.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Drops every contract and usage log. Later calls fail with IllegalStateException.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        entries.clear();
        registry.clear();
        LOG.info("Quota engine closed");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("quota engine is closed");
        }
    }
}
