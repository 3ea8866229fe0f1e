package io.github.protobufx.grpc.dispatch.call;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.concurrent.CompletionStage;

final class CallResults {

    private CallResults() {
    }

    /**
     * Normalizes whatever a handler returned into a sequence of response messages.
     */
    @SuppressWarnings("unchecked")
    static Flux<Object> toFlux(@Nullable Object result) {
        if (result == null) {
            return Flux.empty();
        }
        if (result instanceof Publisher) {
            return Flux.from((Publisher<Object>) result);
        }
        if (result instanceof CompletionStage) {
            return Mono.fromCompletionStage((CompletionStage<Object>) result)
                    .flatMapMany(CallResults::toFlux);
        }
        return Flux.just(result);
    }
}
