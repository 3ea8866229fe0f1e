package io.github.protobufx.grpc.dispatch.call;

import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Writes a stream of response messages to a {@link GrpcCall} while honouring the call's flow control.
 *
 * <p>Messages produced while the call is congested are queued and written in order once the call drains.
 * The call is ended exactly once: after the last queued message when the source completes, immediately when the
 * call is cancelled (queued messages are dropped), or with an error when the source fails (queued messages are
 * dropped as well).
 */
@Slf4j
public class GrpcStreamWriter {

    /**
     * Subscribes to the source when the returned {@link Mono} is subscribed. The {@code Mono} completes when the
     * call was ended normally or by cancellation and fails with the source's error.
     */
    public <T> Mono<Void> write(Publisher<T> source, GrpcCall<?, ? super T> call) {
        return Mono.create(sink -> new Transfer<T>(call, sink).start(source));
    }

    enum State {
        STREAMING,
        DRAINING,
        COMPLETE,
        CANCELLED,
        FAILED;

        boolean isTerminal() {
            return this == COMPLETE || this == CANCELLED || this == FAILED;
        }
    }

    static final class Transfer<T> {
        private final GrpcCall<?, ? super T> call;
        private final MonoSink<Void> sink;
        private final Queue<T> buffer = new ArrayDeque<>();
        private final Disposable.Swap subscription = Disposables.swap();
        private final CallListener drainListener = payload -> onDrain();
        private final CallListener cancelListener = payload -> onCancel();
        private State state = State.STREAMING;
        private boolean sourceComplete;

        Transfer(GrpcCall<?, ? super T> call, MonoSink<Void> sink) {
            this.call = call;
            this.sink = sink;
        }

        void start(Publisher<T> source) {
            call.on(CallEvent.DRAIN, drainListener);
            call.on(CallEvent.CANCEL, cancelListener);
            if (call.isCancelled()) {
                onCancel();
                return;
            }
            subscription.update(Flux.from(source).subscribe(this::onNext, this::onError, this::onComplete));
        }

        synchronized void onNext(T value) {
            if (state.isTerminal()) {
                return;
            }
            if (state == State.STREAMING) {
                send(value);
            } else {
                buffer.add(value);
            }
        }

        synchronized void onDrain() {
            if (state != State.DRAINING) {
                return;
            }
            state = State.STREAMING;
            while (state == State.STREAMING && !buffer.isEmpty()) {
                send(buffer.poll());
            }
            if (state == State.STREAMING && sourceComplete) {
                complete();
            }
        }

        synchronized void onComplete() {
            if (state.isTerminal()) {
                return;
            }
            sourceComplete = true;
            if (buffer.isEmpty()) {
                complete();
            }
        }

        synchronized void onError(Throwable error) {
            if (state.isTerminal()) {
                return;
            }
            log.warn("Response stream failed, dropping {} queued messages: {}", buffer.size(), error.toString());
            state = State.FAILED;
            buffer.clear();
            call.error(error);
            cleanup();
            sink.error(error);
        }

        synchronized void onCancel() {
            if (state.isTerminal()) {
                return;
            }
            log.debug("Call cancelled, dropping {} queued messages", buffer.size());
            state = State.CANCELLED;
            subscription.dispose();
            buffer.clear();
            call.end();
            cleanup();
            sink.success();
        }

        private void send(T value) {
            if (!call.write(value)) {
                state = State.DRAINING;
            }
        }

        private void complete() {
            state = State.COMPLETE;
            call.end();
            cleanup();
            sink.success();
        }

        private void cleanup() {
            call.off(CallEvent.DRAIN, drainListener);
            call.off(CallEvent.CANCEL, cancelListener);
        }
    }
}
