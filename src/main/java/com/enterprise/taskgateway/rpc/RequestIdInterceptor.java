package com.enterprise.taskgateway.rpc;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;

/**
 * Copies the gateway request id from the call options into the
 * {@code x-request-id} header of the outgoing call.
 */
public class RequestIdInterceptor implements ClientInterceptor {

    public static final Metadata.Key<String> REQUEST_ID_HEADER =
        Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

    static final CallOptions.Key<String> REQUEST_ID = CallOptions.Key.create("gateway.requestId");

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                               CallOptions callOptions, Channel next) {
        String requestId = callOptions.getOption(REQUEST_ID);
        ClientCall<ReqT, RespT> call = next.newCall(method, callOptions);
        if (requestId == null) {
            return call;
        }
        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(call) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                headers.put(REQUEST_ID_HEADER, requestId);
                super.start(responseListener, headers);
            }
        };
    }
}
