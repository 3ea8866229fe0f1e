package io.github.protobufx.grpc.dispatch;

public class GrpcDispatchException extends RuntimeException {

    public GrpcDispatchException(String message) {
        super(message);
    }

    public GrpcDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
