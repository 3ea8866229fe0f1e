package com.example.server;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;

/**
 * {@code greet.proto} built in code:
 *
 * <pre>
 * package greet;
 * message GreetRequest { string to = 1; }
 * message GreetResponse { string from = 1; string reply = 2; }
 * service GreetService {
 *   rpc Hello (GreetRequest) returns (GreetResponse);
 *   rpc Hi (GreetRequest) returns (GreetResponse);
 * }
 * </pre>
 */
final class GreetProtos {
    static final Descriptors.FileDescriptor GREET_FILE;

    static {
        var proto = FileDescriptorProto.newBuilder()
                .setName("greet.proto")
                .setPackage("greet")
                .setSyntax("proto3")
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("GreetRequest")
                        .addField(stringField("to", 1)))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("GreetResponse")
                        .addField(stringField("from", 1))
                        .addField(stringField("reply", 2)))
                .addService(ServiceDescriptorProto.newBuilder()
                        .setName("GreetService")
                        .addMethod(unary("Hello"))
                        .addMethod(unary("Hi")))
                .build();
        try {
            GREET_FILE = Descriptors.FileDescriptor.buildFrom(proto, new Descriptors.FileDescriptor[0]);
        } catch (Descriptors.DescriptorValidationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private GreetProtos() {
    }

    static GrpcServiceDefinition greetServiceDefinition() {
        return GrpcServiceDefinition.of(GREET_FILE.findServiceByName("GreetService"));
    }

    static String to(DynamicMessage request) {
        return (String) request.getField(request.getDescriptorForType().findFieldByName("to"));
    }

    static DynamicMessage response(String from, String reply) {
        var type = GREET_FILE.findMessageTypeByName("GreetResponse");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("from"), from)
                .setField(type.findFieldByName("reply"), reply)
                .build();
    }

    private static FieldDescriptorProto stringField(String name, int number) {
        return FieldDescriptorProto.newBuilder()
                .setName(name)
                .setNumber(number)
                .setType(FieldDescriptorProto.Type.TYPE_STRING)
                .setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL)
                .build();
    }

    private static MethodDescriptorProto unary(String name) {
        return MethodDescriptorProto.newBuilder()
                .setName(name)
                .setInputType(".greet.GreetRequest")
                .setOutputType(".greet.GreetResponse")
                .build();
    }
}
