package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.CancellationPolicy;
import io.github.protobufx.grpc.dispatch.definition.NamedServiceDefinition;
import io.grpc.ServerCredentials;
import lombok.Data;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;

@Data
public class GrpcDispatchOptions {
    public static final String DEFAULT_URL = "localhost:5000";

    /**
     * {@code host:port} to listen on.
     */
    String url;
    /**
     * Descriptor set locations handed to the {@link io.github.protobufx.grpc.dispatch.proto.ProtoLoader}.
     */
    List<String> protoPath;
    /**
     * Proto packages whose services are bound, e.g. {@code greet.v1}.
     */
    List<String> packageNames;
    /**
     * Services bound in addition to the ones found in {@link #packageNames}.
     */
    List<NamedServiceDefinition> serviceDefinitions;
    @Nullable
    Integer maxReceiveMessageLength;
    @Nullable
    Integer maxMetadataSize;
    /**
     * Insecure when not set.
     */
    @Nullable
    ServerCredentials credentials;
    boolean gracefulShutdown;
    Duration gracefulShutdownTimeout;
    CancellationPolicy cancellationPolicy;

    public GrpcDispatchOptions() {
        url = DEFAULT_URL;
        protoPath = List.of();
        packageNames = List.of();
        serviceDefinitions = List.of();
        gracefulShutdown = false;
        gracefulShutdownTimeout = Duration.ofSeconds(10);
        cancellationPolicy = CancellationPolicy.STATUS_CODE;
    }
}
