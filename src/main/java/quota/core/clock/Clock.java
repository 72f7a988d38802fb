package quota.core.clock;

/**
 * Time source for the quota engine, in milliseconds.
 * Only differences between readings are meaningful; the origin is arbitrary.
 */
public interface Clock {
    long nowMillis();
}
