package io.github.protobufx.grpc.dispatch.call;

import io.grpc.Metadata;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * {@link GrpcCall} backed by grpc-java's {@link ServerCallStreamObserver}.
 *
 * <p>Must be created while grpc is still invoking the service method, since the ready and cancel
 * handlers can only be installed then.
 */
@Slf4j
public class StreamObserverGrpcCall<ReqT, RespT> extends AbstractGrpcCall<ReqT, RespT> {
    private final ServerCallStreamObserver<RespT> responseObserver;
    private boolean closed;

    public StreamObserverGrpcCall(@Nullable ReqT request, Metadata metadata, ServerCallStreamObserver<RespT> responseObserver) {
        super(request, metadata);
        this.responseObserver = responseObserver;
        responseObserver.setOnReadyHandler(() -> emit(CallEvent.DRAIN, null));
        responseObserver.setOnCancelHandler(() -> {
            synchronized (this) {
                closed = true;
            }
            emit(CallEvent.CANCEL, null);
        });
    }

    @Override
    public synchronized boolean write(RespT message) {
        if (closed) {
            log.debug("Dropping message written to a closed call");
            return false;
        }
        responseObserver.onNext(message);
        return responseObserver.isReady();
    }

    @Override
    public synchronized void end() {
        if (closed) {
            return;
        }
        closed = true;
        responseObserver.onCompleted();
    }

    @Override
    public synchronized void error(Throwable error) {
        if (closed) {
            log.debug("Dropping error for a closed call: {}", error.toString());
            return;
        }
        closed = true;
        responseObserver.onError(GrpcErrors.toStatusException(error));
    }

    @Override
    public boolean isCancelled() {
        return responseObserver.isCancelled();
    }

    /**
     * Sink for the client's request stream; turns it into {@link CallEvent#DATA}, {@link CallEvent#END}
     * and {@link CallEvent#ERROR} events.
     */
    public StreamObserver<ReqT> requestObserver() {
        return new StreamObserver<>() {
            @Override
            public void onNext(ReqT value) {
                emit(CallEvent.DATA, value);
            }

            @Override
            public void onError(Throwable t) {
                emit(CallEvent.ERROR, t);
            }

            @Override
            public void onCompleted() {
                emit(CallEvent.END, null);
            }
        };
    }

    /**
     * Callback completing this call with a single response. A {@code null} value completes it without a message.
     */
    public UnaryCallback<RespT> callback() {
        return (error, value) -> {
            if (error != null) {
                error(error);
                return;
            }
            if (value != null) {
                write(value);
            }
            end();
        };
    }
}
