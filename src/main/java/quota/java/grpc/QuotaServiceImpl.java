package quota.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quota.core.model.RegistrationOutcome;
import quota.core.model.UsageResult;
import quota.java.engine.QuotaEngine;
import quota.proto.HealthCheckRequest;
import quota.proto.HealthCheckResponse;
import quota.proto.QuotaServiceGrpc;
import quota.proto.RegisterRequest;
import quota.proto.RegisterResponse;
import quota.proto.UseRequest;
import quota.proto.UseResponse;

import java.util.List;

/**
 * gRPC service implementation for the quota engine.
 *
 * <p>This is a thin wrapper over QuotaEngine with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Outcome mapping (CONFLICT to ALREADY_EXISTS, NOT_FOUND to NOT_FOUND)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 * </ul>
 *
 * <p>A denied use is a normal response with {@code allowed=false}, not an error.
 *
 * <p>Use reads its key from {@link ApiKeyAuthInterceptor#API_KEY}, so the service must be
 * installed behind that interceptor.
 */
public final class QuotaServiceImpl extends QuotaServiceGrpc.QuotaServiceImplBase {

    private static final Logger LOG = LoggerFactory.getLogger(QuotaServiceImpl.class);

    private final QuotaEngine engine;
    private final RegisterRequestValidator validator;

    /**
     * Creates a new gRPC service wrapping the given engine.
     *
     * @param engine Quota engine (must be thread-safe)
     * @throws IllegalArgumentException if engine is null
     */
    public QuotaServiceImpl(QuotaEngine engine) {
        this(engine, new RegisterRequestValidator());
    }

    public QuotaServiceImpl(QuotaEngine engine, RegisterRequestValidator validator) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.engine = engine;
        this.validator = validator;
    }

    @Override
    public void register(RegisterRequest request, StreamObserver<RegisterResponse> responseObserver) {
        try {
            List<String> violations = validator.validate(request);
            if (!violations.isEmpty()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription(String.join("; ", violations))
                        .asRuntimeException()
                );
                return;
            }

            RegistrationOutcome outcome = engine.register(
                request.getApiKey(),
                request.getQuota(),
                RegisterRequestValidator.toDuration(request.getTimeLimit()),
                request.getForce()
            );

            switch (outcome) {
                case CREATED -> respond(responseObserver, RegisterResponse.Outcome.CREATED,
                    "API key was registered successfully.");
                case OVERWRITTEN -> respond(responseObserver, RegisterResponse.Outcome.OVERWRITTEN,
                    "API key registration overwritten.");
                case CONFLICT -> responseObserver.onError(
                    Status.ALREADY_EXISTS
                        .withDescription("Overwriting API Key is not permissible without the force flag.")
                        .asRuntimeException()
                );
            }
        } catch (IllegalArgumentException e) {
            // Engine-side contract checks (should be caught by the validator above)
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (IllegalStateException e) {
            responseObserver.onError(unavailable(e));
        } catch (Exception e) {
            LOG.error("Register failed", e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void use(UseRequest request, StreamObserver<UseResponse> responseObserver) {
        try {
            String key = ApiKeyAuthInterceptor.API_KEY.get();
            if (key == null) {
                responseObserver.onError(
                    Status.UNAUTHENTICATED
                        .withDescription("x-api-key header is required.")
                        .asRuntimeException()
                );
                return;
            }

            UsageResult result = engine.checkAndRecord(key);

            switch (result.decision()) {
                case NOT_FOUND -> responseObserver.onError(
                    Status.NOT_FOUND
                        .withDescription("Provided API key was not found. "
                            + "Please register an API key before attempting to use it.")
                        .asRuntimeException()
                );
                case ADMITTED, DENIED -> {
                    responseObserver.onNext(UseResponse.newBuilder()
                        .setAllowed(result.isAdmitted())
                        .setUsageLeft(result.usageLeft())
                        .setNextResetMs(result.msUntilReset())
                        .build());
                    responseObserver.onCompleted();
                }
            }
        } catch (IllegalStateException e) {
            responseObserver.onError(unavailable(e));
        } catch (Exception e) {
            LOG.error("Use failed", e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(engine.isClosed()
                ? HealthCheckResponse.Status.NOT_SERVING
                : HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static void respond(StreamObserver<RegisterResponse> responseObserver,
                                RegisterResponse.Outcome outcome,
                                String message) {
        responseObserver.onNext(RegisterResponse.newBuilder()
            .setOutcome(outcome)
            .setMessage(message)
            .build());
        responseObserver.onCompleted();
    }

    private static RuntimeException unavailable(IllegalStateException e) {
        return Status.UNAVAILABLE
            .withDescription(e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }

    private static RuntimeException internal(Exception e) {
        return Status.INTERNAL
            .withDescription("Internal error: " + e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }
}
