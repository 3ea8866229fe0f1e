package io.github.protobufx.grpc.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;
import lombok.Value;

/**
 * Lookup key of a registered handler: service name, rpc name and the streaming type the handler expects.
 * Two patterns with the same three values are equal.
 */
@Value
public class GrpcPattern {
    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @NonNull
    String service;
    @NonNull
    String rpc;
    @NonNull
    GrpcMethodStreamingType streaming;

    public static GrpcPattern of(String service, String rpc, GrpcMethodStreamingType streaming) {
        return new GrpcPattern(service, rpc, streaming);
    }

    /**
     * Parses the JSON form {@code {"service": "...", "rpc": "...", "streaming": "no_stream"}}.
     * Property order does not matter and a missing {@code streaming} means {@code no_stream}.
     */
    public static GrpcPattern parse(String json) {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid pattern: " + json, e);
        }
        if (node == null || !node.isObject() || !node.hasNonNull("service") || !node.hasNonNull("rpc")) {
            throw new IllegalArgumentException("Pattern requires 'service' and 'rpc': " + json);
        }
        var streaming = node.hasNonNull("streaming")
                ? GrpcMethodStreamingType.fromCode(node.get("streaming").asText())
                : GrpcMethodStreamingType.NO_STREAMING;
        return new GrpcPattern(node.get("service").asText(), node.get("rpc").asText(), streaming);
    }

    public String toJson() {
        ObjectNode node = OBJECT_MAPPER.createObjectNode()
                .put("service", service)
                .put("rpc", rpc)
                .put("streaming", streaming.getCode());
        return node.toString();
    }
}
