package io.github.protobufx.grpc.dispatch;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlers by {@link GrpcPattern}. Filled before the server starts and only read afterwards.
 */
@Slf4j
public class MessageHandlerRegistry {
    final Map<GrpcPattern, MessageHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler, replacing any handler already registered for an equal pattern.
     */
    public void register(GrpcPattern pattern, MessageHandler handler) {
        var previous = handlers.put(pattern, handler);
        if (previous != null && previous != handler) {
            log.debug("Handler for {} replaced", pattern.toJson());
        }
    }

    @Nullable
    public MessageHandler lookup(GrpcPattern pattern) {
        return handlers.get(pattern);
    }

    public int size() {
        return handlers.size();
    }
}
