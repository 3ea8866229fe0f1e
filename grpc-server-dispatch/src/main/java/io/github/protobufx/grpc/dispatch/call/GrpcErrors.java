package io.github.protobufx.grpc.dispatch.call;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

public final class GrpcErrors {

    private GrpcErrors() {
    }

    /**
     * Converts an error into something grpc sends with a meaningful status.
     * Status exceptions pass through, anything else becomes {@code UNKNOWN} carrying its message.
     */
    public static Throwable toStatusException(Throwable error) {
        if (error instanceof StatusRuntimeException || error instanceof StatusException) {
            return error;
        }
        return Status.UNKNOWN
                .withDescription(error.getMessage())
                .withCause(error)
                .asRuntimeException();
    }
}
