package io.github.protobufx.grpc.dispatch.definition;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

/**
 * Makes the request headers available to service methods through {@link #METADATA}.
 */
public class MetadataCaptureInterceptor implements ServerInterceptor {
    public static final Context.Key<Metadata> METADATA = Context.key("grpc-dispatch-metadata");

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        return Contexts.interceptCall(Context.current().withValue(METADATA, headers), call, headers, next);
    }

    static Metadata currentMetadata() {
        var metadata = METADATA.get();
        return metadata == null ? new Metadata() : metadata;
    }
}
