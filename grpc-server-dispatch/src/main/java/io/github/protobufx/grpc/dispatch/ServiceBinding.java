package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.CallAdapterType;
import io.github.protobufx.grpc.dispatch.call.ServiceMethod;
import io.github.protobufx.grpc.dispatch.definition.GrpcMethodDefinition;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;
import lombok.Value;

import java.util.Map;

/**
 * The methods of one service that found a handler, keyed by wire method name.
 */
@Value
public class ServiceBinding {
    String name;
    GrpcServiceDefinition service;
    Map<String, BoundMethod> methods;

    @Value
    public static class BoundMethod {
        GrpcMethodDefinition definition;
        GrpcMethodStreamingType streamingType;
        CallAdapterType adapterType;
        ServiceMethod serviceMethod;
    }
}
