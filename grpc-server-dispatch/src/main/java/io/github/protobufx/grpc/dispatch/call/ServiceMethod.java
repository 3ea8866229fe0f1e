package io.github.protobufx.grpc.dispatch.call;

/**
 * A gRPC method ready to be served: invoked once per incoming call.
 */
@FunctionalInterface
public interface ServiceMethod {

    void invoke(GrpcCall<Object, Object> call, UnaryCallback<Object> callback);
}
