package quota.core.model;

/**
 * Outcome of a single use request.
 */
public enum Decision {
    /** The use was counted against the key's window. */
    ADMITTED,

    /** The window is full; nothing was recorded. */
    DENIED,

    /** The key has no registered contract. */
    NOT_FOUND
}
