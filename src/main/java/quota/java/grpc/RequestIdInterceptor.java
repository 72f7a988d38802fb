package quota.java.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Gives every call a request id and logs one line when it completes.
 *
 * The id comes from the {@code x-request-id} header when present and non-empty, otherwise
 * a random UUID is generated. It is echoed back in response headers and trailers and put in
 * the MDC under {@code request-id} while the completion line is logged.
 */
public final class RequestIdInterceptor implements ServerInterceptor {

    private static final Logger LOG = LoggerFactory.getLogger(RequestIdInterceptor.class);

    public static final Metadata.Key<String> REQUEST_ID_HEADER =
        Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

    public static final Context.Key<String> REQUEST_ID = Context.key("quota-request-id");

    static final String MDC_KEY = "request-id";

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String supplied = headers.get(REQUEST_ID_HEADER);
        String requestId = (supplied != null && !supplied.isEmpty()) ? supplied : UUID.randomUUID().toString();
        String method = call.getMethodDescriptor().getFullMethodName();

        ServerCall<ReqT, RespT> loggingCall = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            @Override
            public void sendHeaders(Metadata responseHeaders) {
                responseHeaders.put(REQUEST_ID_HEADER, requestId);
                super.sendHeaders(responseHeaders);
            }

            @Override
            public void close(Status status, Metadata trailers) {
                trailers.put(REQUEST_ID_HEADER, requestId);
                try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, requestId)) {
                    LOG.info("response status: {} - method: {} - request id: {}", status.getCode(), method, requestId);
                }
                super.close(status, trailers);
            }
        };

        Context context = Context.current().withValue(REQUEST_ID, requestId);
        return Contexts.interceptCall(context, loggingCall, headers, next);
    }
}
