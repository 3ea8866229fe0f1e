package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.GrpcCall;
import io.github.protobufx.grpc.dispatch.call.UnaryCallback;
import io.grpc.Metadata;

import javax.annotation.Nullable;

/**
 * Handler for client streaming methods that reads and writes the raw call itself.
 */
@FunctionalInterface
public interface StreamCallHandler extends MessageHandler {

    /**
     * @param callback where the single response goes, {@code null} when the method streams its responses
     */
    void handleCall(GrpcCall<Object, Object> call, @Nullable UnaryCallback<Object> callback) throws Exception;

    @Override
    default Object handle(Object data, Metadata metadata, GrpcCall<Object, Object> call) throws Exception {
        handleCall(call, null);
        return null;
    }
}
