package io.github.protobufx.grpc.dispatch.call;

import reactor.core.publisher.Mono;

final class CallEvents {

    private CallEvents() {
    }

    /**
     * Emits the event the first time the call fires it. The listener is removed on completion or cancellation.
     */
    static Mono<CallEvent> next(GrpcCall<?, ?> call, CallEvent event) {
        return Mono.create(sink -> {
            CallListener listener = payload -> sink.success(event);
            call.on(event, listener);
            sink.onDispose(() -> call.off(event, listener));
            if (event == CallEvent.CANCEL && call.isCancelled()) {
                sink.success(event);
            }
        });
    }
}
