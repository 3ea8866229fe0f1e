package io.github.protobufx.grpc.dispatch;

import lombok.Getter;

/**
 * A package requested for binding is not part of the loaded proto definitions.
 */
@Getter
public class InvalidGrpcPackageException extends GrpcDispatchException {
    private final String packageName;

    public InvalidGrpcPackageException(String packageName) {
        super(String.format("The invalid gRPC package (package \"%s\" not found)", packageName));
        this.packageName = packageName;
    }
}
