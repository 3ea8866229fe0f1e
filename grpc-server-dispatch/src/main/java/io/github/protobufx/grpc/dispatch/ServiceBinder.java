package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.ServiceMethodFactory;
import io.github.protobufx.grpc.dispatch.definition.GrpcMethodDefinition;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;

import static io.github.protobufx.grpc.dispatch.GrpcMethodStreamingType.NO_STREAMING;
import static io.github.protobufx.grpc.dispatch.GrpcMethodStreamingType.PT_STREAMING;
import static io.github.protobufx.grpc.dispatch.GrpcMethodStreamingType.RX_STREAMING;

/**
 * Maps the methods of a service definition to registered handlers.
 *
 * <p>For client streaming methods a {@link GrpcMethodStreamingType#RX_STREAMING} handler is preferred over a
 * {@link GrpcMethodStreamingType#PT_STREAMING} one; other methods need a
 * {@link GrpcMethodStreamingType#NO_STREAMING} handler. When nothing is registered under the wire method name the
 * lookup is repeated with the method's original name. Methods without a handler are left out.
 */
@Slf4j
@AllArgsConstructor
public class ServiceBinder {
    final MessageHandlerRegistry registry;
    final ServiceMethodFactory serviceMethodFactory;

    public ServiceBinding bind(String serviceName, GrpcServiceDefinition service) {
        var methods = new LinkedHashMap<String, ServiceBinding.BoundMethod>();
        for (GrpcMethodDefinition method : service.getMethods().values()) {
            var bound = bindMethod(serviceName, method);
            if (bound == null) {
                log.debug("No handler for {}/{}, method left unbound", serviceName, method.getName());
                continue;
            }
            log.debug("Bound {}/{} to {} handler", serviceName, method.getName(), bound.getAdapterType());
            methods.put(method.getName(), bound);
        }
        return new ServiceBinding(serviceName, service, Collections.unmodifiableMap(methods));
    }

    @Nullable
    ServiceBinding.BoundMethod bindMethod(String serviceName, GrpcMethodDefinition method) {
        GrpcMethodStreamingType streamingType;
        MessageHandler handler;
        if (method.isRequestStream()) {
            streamingType = RX_STREAMING;
            handler = registry.lookup(GrpcPattern.of(serviceName, method.getName(), streamingType));
            if (handler == null) {
                streamingType = PT_STREAMING;
                handler = registry.lookup(GrpcPattern.of(serviceName, method.getName(), streamingType));
            }
        } else {
            streamingType = NO_STREAMING;
            handler = registry.lookup(GrpcPattern.of(serviceName, method.getName(), streamingType));
        }
        if (handler == null && !method.getName().equals(method.getOriginalName())) {
            handler = registry.lookup(GrpcPattern.of(serviceName, method.getOriginalName(), streamingType));
        }
        if (handler == null) {
            return null;
        }
        var adapterType = ServiceMethodFactory.selectAdapter(
                method.isRequestStream(), method.isResponseStream(), streamingType);
        var serviceMethod = serviceMethodFactory.createServiceMethod(handler, adapterType, method.isResponseStream());
        return new ServiceBinding.BoundMethod(method, streamingType, adapterType, serviceMethod);
    }
}
