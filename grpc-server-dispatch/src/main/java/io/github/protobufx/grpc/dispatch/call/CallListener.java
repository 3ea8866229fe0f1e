package io.github.protobufx.grpc.dispatch.call;

import javax.annotation.Nullable;

@FunctionalInterface
public interface CallListener {

    void onEvent(@Nullable Object payload);
}
