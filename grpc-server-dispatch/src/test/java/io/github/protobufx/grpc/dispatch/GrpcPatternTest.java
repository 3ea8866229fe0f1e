package io.github.protobufx.grpc.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GrpcPatternTest {

    @Test
    @DisplayName("Patterns with equal values are equal regardless of the JSON property order")
    void testStructuralEquality() {
        var pattern = GrpcPattern.of("GreetService", "Hello", GrpcMethodStreamingType.RX_STREAMING);

        assertEquals(pattern, GrpcPattern.parse("{\"service\":\"GreetService\",\"rpc\":\"Hello\",\"streaming\":\"rx_stream\"}"));
        assertEquals(pattern, GrpcPattern.parse("{\"streaming\":\"rx_stream\",\"rpc\":\"Hello\",\"service\":\"GreetService\"}"));
        assertEquals(pattern.hashCode(), GrpcPattern.of("GreetService", "Hello", GrpcMethodStreamingType.RX_STREAMING).hashCode());
        assertNotEquals(pattern, GrpcPattern.of("GreetService", "Hello", GrpcMethodStreamingType.PT_STREAMING));
    }

    @Test
    void testJson() {
        var pattern = GrpcPattern.of("GreetService", "Hello", GrpcMethodStreamingType.NO_STREAMING);

        assertEquals("{\"service\":\"GreetService\",\"rpc\":\"Hello\",\"streaming\":\"no_stream\"}", pattern.toJson());
        assertEquals(pattern, GrpcPattern.parse("{\"service\":\"GreetService\",\"rpc\":\"Hello\"}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[]",
            "{\"service\":\"GreetService\"}",
            "{\"service\":\"GreetService\",\"rpc\":\"Hello\",\"streaming\":\"sideways\"}"
    })
    void testInvalidPattern(String json) {
        assertThrows(IllegalArgumentException.class, () -> GrpcPattern.parse(json));
    }
}
