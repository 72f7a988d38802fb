package quota.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quota.core.model.KeyContract;
import quota.core.model.RegistrationOutcome;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link KeyRegistry} backed by a ConcurrentHashMap.
 *
 * Every write installs a fresh {@link KeyContract} with its own generation, so a reader
 * always sees one complete registration.
 */
public final class InMemoryKeyRegistry implements KeyRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryKeyRegistry.class);

    private final ConcurrentHashMap<String, KeyContract> contracts = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    @Override
    public RegistrationOutcome register(String key, int limit, Duration window, boolean force) {
        KeyContract candidate = new KeyContract(key, limit, window, generations.incrementAndGet());

        KeyContract existing = contracts.putIfAbsent(key, candidate);
        if (existing == null) {
            LOG.debug("Registered {}", candidate);
            return RegistrationOutcome.CREATED;
        }
        if (!force) {
            LOG.info("Registration conflict, key already holds {}", existing);
            return RegistrationOutcome.CONFLICT;
        }

        contracts.put(key, candidate);
        LOG.debug("Overwrote {} with {}", existing, candidate);
        return RegistrationOutcome.OVERWRITTEN;
    }

    @Override
    public Optional<KeyContract> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contracts.get(key));
    }

    @Override
    public int size() {
        return contracts.size();
    }

    @Override
    public void clear() {
        contracts.clear();
    }
}
