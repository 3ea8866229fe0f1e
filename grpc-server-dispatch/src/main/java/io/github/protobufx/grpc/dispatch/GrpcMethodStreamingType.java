package io.github.protobufx.grpc.dispatch;


import java.util.Arrays;

/**
 * How a registered handler wants to consume a method's request side.
 */
public enum GrpcMethodStreamingType {
    /**
     * Single request value, handed over as is.
     */
    NO_STREAMING("no_stream"),
    /**
     * Request stream pushed to the handler as a {@link reactor.core.publisher.Flux}.
     */
    RX_STREAMING("rx_stream"),
    /**
     * Raw call handed to the handler, which drives reads and writes itself.
     */
    PT_STREAMING("pt_stream");

    private final String code;

    GrpcMethodStreamingType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static GrpcMethodStreamingType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown streaming type: " + code));
    }
}
