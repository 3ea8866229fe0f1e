package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.GrpcCall;
import io.grpc.Metadata;

/**
 * Application code bound to a gRPC method.
 *
 * <p>The returned value is what the client receives: a plain message, a {@link org.reactivestreams.Publisher}
 * of messages, a {@link java.util.concurrent.CompletionStage} of either, or {@code null} for no message.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * @param data the request message, or a {@link reactor.core.publisher.Flux} of request messages
     *             when the handler was registered with {@link GrpcMethodStreamingType#RX_STREAMING}
     * @param metadata the request headers
     * @param call the call being served
     */
    Object handle(Object data, Metadata metadata, GrpcCall<Object, Object> call) throws Exception;
}
