package io.github.protobufx.grpc.dispatch.definition;

import lombok.Value;

/**
 * A service definition together with the service name handlers are registered under.
 */
@Value(staticConstructor = "of")
public class NamedServiceDefinition {
    String name;
    GrpcServiceDefinition service;
}
