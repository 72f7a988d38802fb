package quota.java.grpc;

import quota.proto.RegisterRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Format and range checks for registration payloads, applied before the engine is called.
 */
public final class RegisterRequestValidator {

    // Range allowed by google.protobuf.Duration
    private static final long MAX_DURATION_SECONDS = 315_576_000_000L;
    private static final int NANOS_PER_SECOND = 1_000_000_000;

    /**
     * @return every violation found, empty if the request is valid
     */
    public List<String> validate(RegisterRequest request) {
        List<String> violations = new ArrayList<>();

        if (!isUuid(request.getApiKey())) {
            violations.add("apiKey: Should be a UUID format");
        }

        if (request.getQuota() < 1) {
            violations.add("quota: The quota must be positive.");
        } else if (request.getQuota() == Integer.MAX_VALUE) {
            violations.add("quota: Quota must be less than 2,147,483,647");
        }

        if (!request.hasTimeLimit() || !isPositiveAndFinite(request.getTimeLimit())) {
            violations.add("timeLimit: Time limit must be finite and greater than 0");
        } else if (toDuration(request.getTimeLimit()).toMillis() < 1) {
            violations.add("timeLimit: Time limit must be at least 1ms");
        }

        return violations;
    }

    static Duration toDuration(com.google.protobuf.Duration duration) {
        return Duration.ofSeconds(duration.getSeconds(), duration.getNanos());
    }

    private static boolean isUuid(String value) {
        if (value.isEmpty()) {
            return false;
        }
        try {
            // fromString accepts shortened groups, require the canonical form
            return UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isPositiveAndFinite(com.google.protobuf.Duration duration) {
        long seconds = duration.getSeconds();
        int nanos = duration.getNanos();
        if (seconds > MAX_DURATION_SECONDS || nanos < 0 || nanos >= NANOS_PER_SECOND) {
            return false;
        }
        return seconds > 0 || (seconds == 0 && nanos > 0);
    }
}
