package io.github.protobufx.grpc.dispatch.definition;

import com.google.common.base.CaseFormat;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;
import io.grpc.MethodDescriptor;
import io.grpc.protobuf.ProtoUtils;
import lombok.Value;

/**
 * One method of a {@link GrpcServiceDefinition}.
 */
@Value
public class GrpcMethodDefinition {
    /**
     * Method name as it appears on the wire.
     */
    String name;
    /**
     * Alternative spelling handlers may be registered under (lowerCamel of the wire name).
     */
    String originalName;
    boolean requestStream;
    boolean responseStream;
    MethodDescriptor<?, ?> methodDescriptor;

    public static GrpcMethodDefinition of(MethodDescriptor<?, ?> methodDescriptor) {
        var type = methodDescriptor.getType();
        var name = methodDescriptor.getBareMethodName();
        return new GrpcMethodDefinition(
                name,
                toOriginalName(name),
                !type.clientSendsOneMessage(),
                !type.serverSendsOneMessage(),
                methodDescriptor);
    }

    /**
     * Definition exchanging {@link DynamicMessage}s for a method loaded from a proto descriptor.
     */
    public static GrpcMethodDefinition of(Descriptors.MethodDescriptor method) {
        var methodDescriptor = MethodDescriptor.<DynamicMessage, DynamicMessage>newBuilder()
                .setType(methodType(method.isClientStreaming(), method.isServerStreaming()))
                .setFullMethodName(MethodDescriptor.generateFullMethodName(
                        method.getService().getFullName(), method.getName()))
                .setRequestMarshaller(ProtoUtils.marshaller(DynamicMessage.getDefaultInstance(method.getInputType())))
                .setResponseMarshaller(ProtoUtils.marshaller(DynamicMessage.getDefaultInstance(method.getOutputType())))
                .build();
        return new GrpcMethodDefinition(
                method.getName(),
                toOriginalName(method.getName()),
                method.isClientStreaming(),
                method.isServerStreaming(),
                methodDescriptor);
    }

    static MethodDescriptor.MethodType methodType(boolean requestStream, boolean responseStream) {
        if (requestStream) {
            return responseStream
                    ? MethodDescriptor.MethodType.BIDI_STREAMING : MethodDescriptor.MethodType.CLIENT_STREAMING;
        }
        return responseStream
                ? MethodDescriptor.MethodType.SERVER_STREAMING : MethodDescriptor.MethodType.UNARY;
    }

    static String toOriginalName(String name) {
        return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_CAMEL, name);
    }
}
