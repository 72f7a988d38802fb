package quota.java.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import quota.java.engine.KeyRegistry;
import quota.proto.QuotaServiceGrpc;

/**
 * {@link ServerInterceptor} that lets a Use call through only when its {@code x-api-key}
 * header names a registered key, and closes it with UNAUTHENTICATED otherwise.
 * Other methods pass through untouched.
 */
public final class ApiKeyAuthInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> API_KEY_HEADER =
        Metadata.Key.of("x-api-key", Metadata.ASCII_STRING_MARSHALLER);

    /** Authenticated key of the current call. */
    public static final Context.Key<String> API_KEY = Context.key("quota-api-key");

    private static final Status UNREGISTERED_STATUS =
        Status.UNAUTHENTICATED.withDescription("Please register an API key before attempting to use it.");

    private final KeyRegistry registry;

    public ApiKeyAuthInterceptor(KeyRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String method = call.getMethodDescriptor().getFullMethodName();
        if (!QuotaServiceGrpc.getUseMethod().getFullMethodName().equals(method)) {
            return next.startCall(call, headers);
        }

        String key = headers.get(API_KEY_HEADER);
        if (key == null || key.isEmpty() || !registry.contains(key)) {
            call.close(UNREGISTERED_STATUS, new Metadata());
            return new ServerCall.Listener<ReqT>() {};
        }

        Context context = Context.current().withValue(API_KEY, key);
        return Contexts.interceptCall(context, call, headers, next);
    }
}
