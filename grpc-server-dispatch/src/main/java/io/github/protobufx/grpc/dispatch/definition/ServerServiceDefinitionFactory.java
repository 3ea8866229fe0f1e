package io.github.protobufx.grpc.dispatch.definition;

import io.github.protobufx.grpc.dispatch.ServiceBinding;
import io.github.protobufx.grpc.dispatch.call.GrpcCall;
import io.github.protobufx.grpc.dispatch.call.ServiceMethod;
import io.github.protobufx.grpc.dispatch.call.StreamObserverGrpcCall;
import io.github.protobufx.grpc.dispatch.call.UnaryCallback;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;

import static io.grpc.stub.ServerCalls.asyncBidiStreamingCall;
import static io.grpc.stub.ServerCalls.asyncClientStreamingCall;
import static io.grpc.stub.ServerCalls.asyncServerStreamingCall;
import static io.grpc.stub.ServerCalls.asyncUnaryCall;

/**
 * Turns a {@link ServiceBinding} into a grpc-java service that can be added to a server.
 * Methods without a binding are not registered, so grpc answers them with {@code UNIMPLEMENTED}.
 */
public class ServerServiceDefinitionFactory {
    private final MetadataCaptureInterceptor metadataCaptureInterceptor = new MetadataCaptureInterceptor();

    public ServerServiceDefinition create(ServiceBinding binding) {
        var builder = ServerServiceDefinition.builder(binding.getService().getFullName());
        binding.getMethods().values().forEach(bound ->
                addMethod(builder, bound.getDefinition().getMethodDescriptor(), bound.getServiceMethod()));
        return ServerInterceptors.intercept(builder.build(), metadataCaptureInterceptor);
    }

    private static <ReqT, RespT> void addMethod(ServerServiceDefinition.Builder builder,
                                                MethodDescriptor<ReqT, RespT> methodDescriptor,
                                                ServiceMethod serviceMethod) {
        builder.addMethod(methodDescriptor, callHandler(methodDescriptor.getType(), serviceMethod));
    }

    static <ReqT, RespT> ServerCallHandler<ReqT, RespT> callHandler(MethodDescriptor.MethodType type,
                                                                   ServiceMethod serviceMethod) {
        switch (type) {
            case UNARY:
                return asyncUnaryCall((request, responseObserver) -> invoke(serviceMethod, request, responseObserver));
            case SERVER_STREAMING:
                return asyncServerStreamingCall((request, responseObserver) -> invoke(serviceMethod, request, responseObserver));
            case CLIENT_STREAMING:
                return asyncClientStreamingCall(responseObserver -> invoke(serviceMethod, null, responseObserver));
            case BIDI_STREAMING:
                return asyncBidiStreamingCall(responseObserver -> invoke(serviceMethod, null, responseObserver));
            default:
                throw new IllegalArgumentException("Unsupported method type: " + type);
        }
    }

    @SuppressWarnings("unchecked")
    private static <ReqT, RespT> StreamObserver<ReqT> invoke(ServiceMethod serviceMethod, ReqT request,
                                                             StreamObserver<RespT> responseObserver) {
        var call = new StreamObserverGrpcCall<>(request, MetadataCaptureInterceptor.currentMetadata(),
                (ServerCallStreamObserver<RespT>) responseObserver);
        serviceMethod.invoke((GrpcCall<Object, Object>) (GrpcCall<?, ?>) call,
                (UnaryCallback<Object>) (UnaryCallback<?>) call.callback());
        return call.requestObserver();
    }
}
