package quota.java.engine;

import quota.core.model.KeyContract;
import quota.core.model.RegistrationOutcome;

import java.time.Duration;
import java.util.Optional;

/**
 * Owns the mapping from key to its quota contract.
 *
 * Implementations must let registrations of different keys proceed without a shared lock.
 * Same-key registrations may resolve in either order (last writer wins).
 */
public interface KeyRegistry {

    /**
     * Registers a contract for a key.
     *
     * @param key The key (already validated by the caller)
     * @param limit Uses permitted per window
     * @param window Window length
     * @param force Whether to replace an existing contract
     * @return CREATED if the key was new, OVERWRITTEN if replaced with force, CONFLICT otherwise
     * @throws IllegalArgumentException if the contract is invalid
     */
    RegistrationOutcome register(String key, int limit, Duration window, boolean force);

    default RegistrationOutcome register(String key, int limit, Duration window) {
        return register(key, limit, window, false);
    }

    Optional<KeyContract> lookup(String key);

    default boolean contains(String key) {
        return lookup(key).isPresent();
    }

    int size();

    void clear();
}
