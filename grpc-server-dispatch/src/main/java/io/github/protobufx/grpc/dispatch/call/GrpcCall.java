package io.github.protobufx.grpc.dispatch.call;

import io.grpc.Metadata;

import javax.annotation.Nullable;

/**
 * One in-flight server call as seen by handlers and call adapters.
 *
 * @param <ReqT> request message type
 * @param <RespT> response message type
 */
public interface GrpcCall<ReqT, RespT> {

    /**
     * The request message, or {@code null} when the client streams its requests (see {@link CallEvent#DATA}).
     */
    @Nullable
    ReqT getRequest();

    Metadata getMetadata();

    /**
     * Sends a response message.
     *
     * @return {@code false} when the transport is congested; a {@link CallEvent#DRAIN} follows once it is not
     */
    boolean write(RespT message);

    /**
     * Completes the call successfully. Does nothing once the call is closed.
     */
    void end();

    /**
     * Completes the call with an error status. Does nothing once the call is closed.
     */
    void error(Throwable error);

    void on(CallEvent event, CallListener listener);

    void off(CallEvent event, CallListener listener);

    boolean isCancelled();
}
