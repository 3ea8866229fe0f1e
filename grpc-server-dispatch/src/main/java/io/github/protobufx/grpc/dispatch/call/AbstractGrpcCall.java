package io.github.protobufx.grpc.dispatch.call;

import io.grpc.Metadata;

import javax.annotation.Nullable;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener bookkeeping shared by {@link GrpcCall} implementations.
 */
public abstract class AbstractGrpcCall<ReqT, RespT> implements GrpcCall<ReqT, RespT> {
    private final Map<CallEvent, List<CallListener>> listeners = new EnumMap<>(CallEvent.class);
    @Nullable
    private final ReqT request;
    private final Metadata metadata;

    protected AbstractGrpcCall(@Nullable ReqT request, Metadata metadata) {
        this.request = request;
        this.metadata = metadata;
        for (CallEvent event : CallEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    @Nullable
    @Override
    public ReqT getRequest() {
        return request;
    }

    @Override
    public Metadata getMetadata() {
        return metadata;
    }

    @Override
    public void on(CallEvent event, CallListener listener) {
        listeners.get(event).add(listener);
    }

    @Override
    public void off(CallEvent event, CallListener listener) {
        listeners.get(event).remove(listener);
    }

    public int listenerCount(CallEvent event) {
        return listeners.get(event).size();
    }

    protected void emit(CallEvent event, @Nullable Object payload) {
        for (CallListener listener : listeners.get(event)) {
            listener.onEvent(payload);
        }
    }
}
