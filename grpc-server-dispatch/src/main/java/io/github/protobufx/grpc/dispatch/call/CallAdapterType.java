package io.github.protobufx.grpc.dispatch.call;

public enum CallAdapterType {
    UNARY,
    SERVER_STREAM,
    CLIENT_STREAM_REACTIVE,
    CLIENT_STREAM_PASSTHROUGH
}
