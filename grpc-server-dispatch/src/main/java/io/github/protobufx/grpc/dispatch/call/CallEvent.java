package io.github.protobufx.grpc.dispatch.call;

/**
 * Events a {@link GrpcCall} emits to its listeners.
 */
public enum CallEvent {
    /**
     * A request message arrived; the payload is the message.
     */
    DATA,
    /**
     * The client half-closed its request stream.
     */
    END,
    /**
     * The request stream failed; the payload is the {@link Throwable}.
     */
    ERROR,
    /**
     * The transport can take more response messages after a {@link GrpcCall#write} returned {@code false}.
     */
    DRAIN,
    /**
     * The call was cancelled by the client or timed out.
     */
    CANCEL
}
