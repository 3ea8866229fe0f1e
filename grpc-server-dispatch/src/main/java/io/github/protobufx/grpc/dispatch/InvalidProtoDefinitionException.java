package io.github.protobufx.grpc.dispatch;

import lombok.Getter;

/**
 * A descriptor source could not be read or does not form a consistent set of proto files.
 */
@Getter
public class InvalidProtoDefinitionException extends GrpcDispatchException {
    private final String path;

    public InvalidProtoDefinitionException(String path, Throwable cause) {
        super(String.format("The invalid .proto definition (file at \"%s\" not found or malformed)", path), cause);
        this.path = path;
    }
}
