package io.github.protobufx.grpc.dispatch.definition;

import com.google.protobuf.Descriptors;
import io.grpc.MethodDescriptor;
import io.grpc.ServiceDescriptor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A gRPC service as a map of wire method name to method definition.
 */
@Value
public class GrpcServiceDefinition {
    /**
     * Fully qualified service name, e.g. {@code greet.v1.GreetService}.
     */
    String fullName;
    Map<String, GrpcMethodDefinition> methods;

    public GrpcServiceDefinition(String fullName, Map<String, GrpcMethodDefinition> methods) {
        this.fullName = fullName;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    /**
     * Service whose messages are {@link com.google.protobuf.DynamicMessage}s described by the proto descriptor.
     */
    public static GrpcServiceDefinition of(Descriptors.ServiceDescriptor service) {
        var methods = new LinkedHashMap<String, GrpcMethodDefinition>();
        for (Descriptors.MethodDescriptor method : service.getMethods()) {
            methods.put(method.getName(), GrpcMethodDefinition.of(method));
        }
        return new GrpcServiceDefinition(service.getFullName(), methods);
    }

    /**
     * Service using the marshallers of a precompiled descriptor, e.g. {@code GreeterGrpc.getServiceDescriptor()}.
     */
    public static GrpcServiceDefinition of(ServiceDescriptor service) {
        var methods = new LinkedHashMap<String, GrpcMethodDefinition>();
        for (MethodDescriptor<?, ?> method : service.getMethods()) {
            var definition = GrpcMethodDefinition.of(method);
            methods.put(definition.getName(), definition);
        }
        return new GrpcServiceDefinition(service.getName(), methods);
    }
}
