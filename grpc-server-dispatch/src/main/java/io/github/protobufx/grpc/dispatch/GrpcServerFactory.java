package io.github.protobufx.grpc.dispatch;

import io.grpc.Server;
import io.grpc.ServerServiceDefinition;

import java.util.List;

/**
 * Creates the (not yet started) transport server hosting the bound services.
 */
@FunctionalInterface
public interface GrpcServerFactory {

    Server create(GrpcDispatchOptions options, List<ServerServiceDefinition> services);
}
