package io.github.protobufx.grpc.dispatch.proto;

import java.util.List;

/**
 * Loads proto definitions into a namespace tree.
 */
public interface ProtoLoader {

    /**
     * @throws io.github.protobufx.grpc.dispatch.InvalidProtoDefinitionException if a source cannot be loaded
     */
    ProtoNode.Namespace load(List<String> protoPaths);
}
