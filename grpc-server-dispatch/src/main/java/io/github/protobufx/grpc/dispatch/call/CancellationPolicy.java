package io.github.protobufx.grpc.dispatch.call;

import io.grpc.Status;

import java.util.Locale;

/**
 * Decides whether an error seen while reading a request stream means the client went away.
 * Such errors end the request stream instead of failing it.
 */
public enum CancellationPolicy {
    /**
     * The error carries the grpc {@code CANCELLED} status.
     */
    STATUS_CODE {
        @Override
        public boolean isCancellation(Throwable error) {
            return Status.fromThrowable(error).getCode() == Status.Code.CANCELLED;
        }
    },
    /**
     * The error's string form contains "cancelled", ignoring case.
     * For transports that do not report a status.
     */
    MESSAGE_CONTAINS {
        @Override
        public boolean isCancellation(Throwable error) {
            return String.valueOf(error).toLowerCase(Locale.ROOT).contains("cancelled");
        }
    };

    public abstract boolean isCancellation(Throwable error);
}
