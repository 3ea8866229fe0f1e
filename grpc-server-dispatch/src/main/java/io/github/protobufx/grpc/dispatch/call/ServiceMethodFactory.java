package io.github.protobufx.grpc.dispatch.call;

import io.github.protobufx.grpc.dispatch.GrpcMethodStreamingType;
import io.github.protobufx.grpc.dispatch.MessageHandler;
import io.github.protobufx.grpc.dispatch.StreamCallHandler;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps handlers into {@link ServiceMethod}s, one adapter per combination of method shape and handler style.
 */
@Slf4j
@AllArgsConstructor
public class ServiceMethodFactory {
    final GrpcStreamWriter streamWriter;
    final CancellationPolicy cancellationPolicy;

    public ServiceMethodFactory() {
        this(new GrpcStreamWriter(), CancellationPolicy.STATUS_CODE);
    }

    /**
     * Picks the adapter for a method given the streaming type its handler was found under.
     */
    public static CallAdapterType selectAdapter(boolean requestStream, boolean responseStream,
                                                GrpcMethodStreamingType streamingType) {
        if (requestStream) {
            if (streamingType == GrpcMethodStreamingType.RX_STREAMING) {
                return CallAdapterType.CLIENT_STREAM_REACTIVE;
            }
            if (streamingType == GrpcMethodStreamingType.PT_STREAMING) {
                return CallAdapterType.CLIENT_STREAM_PASSTHROUGH;
            }
        }
        return responseStream ? CallAdapterType.SERVER_STREAM : CallAdapterType.UNARY;
    }

    public ServiceMethod createServiceMethod(MessageHandler handler, CallAdapterType adapterType, boolean responseStream) {
        switch (adapterType) {
            case UNARY:
                return createUnaryServiceMethod(handler);
            case SERVER_STREAM:
                return createStreamServiceMethod(handler);
            case CLIENT_STREAM_REACTIVE:
                return createRequestStreamMethod(handler, responseStream);
            case CLIENT_STREAM_PASSTHROUGH:
                return handler instanceof StreamCallHandler
                        ? createStreamCallMethod((StreamCallHandler) handler, responseStream)
                        : createPlainStreamCallMethod(handler, responseStream);
            default:
                throw new IllegalArgumentException("Unsupported adapter: " + adapterType);
        }
    }

    /**
     * Delivers exactly one callback: the first response message, {@code null} if there is none, or the error.
     */
    public ServiceMethod createUnaryServiceMethod(MessageHandler handler) {
        return (call, callback) -> {
            Flux<Object> result;
            try {
                result = CallResults.toFlux(handler.handle(call.getRequest(), call.getMetadata(), call));
            } catch (Exception e) {
                callback.onComplete(e, null);
                return;
            }
            result.next()
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .subscribe(
                            value -> callback.onComplete(null, value.orElse(null)),
                            error -> callback.onComplete(error, null));
        };
    }

    public ServiceMethod createStreamServiceMethod(MessageHandler handler) {
        return (call, callback) -> {
            Flux<Object> result;
            try {
                result = CallResults.toFlux(handler.handle(call.getRequest(), call.getMetadata(), call));
            } catch (Exception e) {
                call.error(e);
                return;
            }
            writeToCall(result, call);
        };
    }

    /**
     * Pushes the request stream to the handler as a {@link Flux}. For a single response, the last message the
     * handler produces before completing or the call being cancelled is sent.
     */
    public ServiceMethod createRequestStreamMethod(MessageHandler handler, boolean responseStream) {
        return (call, callback) -> {
            Sinks.Many<Object> requests = Sinks.many().unicast().onBackpressureBuffer();
            call.on(CallEvent.DATA, requests::tryEmitNext);
            call.on(CallEvent.ERROR, payload -> {
                var error = (Throwable) payload;
                if (cancellationPolicy.isCancellation(error)) {
                    log.debug("Request stream cancelled by client: {}", error.toString());
                    requests.tryEmitComplete();
                    call.end();
                    return;
                }
                requests.tryEmitError(error);
            });
            call.on(CallEvent.END, payload -> requests.tryEmitComplete());

            Flux<Object> result;
            try {
                result = CallResults.toFlux(handler.handle(requests.asFlux(), call.getMetadata(), call));
            } catch (Exception e) {
                if (responseStream) {
                    call.error(e);
                } else {
                    callback.onComplete(e, null);
                }
                return;
            }

            if (responseStream) {
                writeToCall(result, call);
                return;
            }
            var failed = new AtomicBoolean();
            result.takeUntilOther(CallEvents.next(call, CallEvent.CANCEL))
                    .onErrorResume(error -> {
                        failed.set(true);
                        callback.onComplete(error, null);
                        return Mono.empty();
                    })
                    .map(Optional::of)
                    .last(Optional.empty())
                    .subscribe(response -> {
                        if (response.isPresent()) {
                            callback.onComplete(null, response.get());
                        } else if (!failed.get()) {
                            call.end();
                        }
                    });
        };
    }

    /**
     * Hands the raw call over. The handler gets the callback only when the method has a single response.
     */
    public ServiceMethod createStreamCallMethod(StreamCallHandler handler, boolean responseStream) {
        return (call, callback) -> {
            try {
                handler.handleCall(call, responseStream ? null : callback);
            } catch (Exception e) {
                if (responseStream) {
                    call.error(e);
                } else {
                    callback.onComplete(e, null);
                }
            }
        };
    }

    /**
     * Pass-through for a handler that is not a {@link StreamCallHandler}: it gets the raw call as its data and what
     * it returns is sent like a handler result. For a single response the first value goes to the callback; a
     * {@code null} result leaves completing the call to the handler.
     */
    public ServiceMethod createPlainStreamCallMethod(MessageHandler handler, boolean responseStream) {
        return (call, callback) -> {
            Object result;
            try {
                result = handler.handle(call, call.getMetadata(), call);
            } catch (Exception e) {
                if (responseStream) {
                    call.error(e);
                } else {
                    callback.onComplete(e, null);
                }
                return;
            }
            if (result == null) {
                return;
            }
            if (responseStream) {
                writeToCall(CallResults.toFlux(result), call);
                return;
            }
            CallResults.toFlux(result).next()
                    .subscribe(
                            value -> callback.onComplete(null, value),
                            error -> callback.onComplete(error, null));
        };
    }

    private void writeToCall(Flux<Object> result, GrpcCall<Object, Object> call) {
        streamWriter.write(result, call)
                .subscribe(null, error -> log.debug("Response stream ended with error: {}", error.toString()));
    }
}
