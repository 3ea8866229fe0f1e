package io.github.protobufx.grpc.dispatch.call;

import javax.annotation.Nullable;

/**
 * Completes a call that has a single response: either with an error or with a value.
 */
@FunctionalInterface
public interface UnaryCallback<T> {

    void onComplete(@Nullable Throwable error, @Nullable T value);
}
