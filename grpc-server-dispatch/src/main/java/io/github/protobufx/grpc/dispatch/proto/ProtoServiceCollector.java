package io.github.protobufx.grpc.dispatch.proto;

import com.google.common.base.Splitter;
import io.github.protobufx.grpc.dispatch.definition.NamedServiceDefinition;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds services in a tree of loaded proto definitions.
 */
public final class ProtoServiceCollector {

    private ProtoServiceCollector() {
    }

    /**
     * Resolves a dotted package name, e.g. {@code greet.v1}, to its node.
     *
     * @return the node, or {@code null} when some segment does not exist
     */
    @Nullable
    public static ProtoNode lookupPackage(ProtoNode.Namespace root, String packageName) {
        ProtoNode node = root;
        for (String name : Splitter.on('.').split(packageName)) {
            if (!(node instanceof ProtoNode.Namespace)) {
                return null;
            }
            node = ((ProtoNode.Namespace) node).get(name);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    /**
     * Collects every service below the namespace with its dotted name relative to it.
     * For package {@code Bundle} containing {@code FirstService.Events} the service is named
     * {@code FirstService.Events}.
     */
    public static List<NamedServiceDefinition> getServiceNames(ProtoNode.Namespace namespace) {
        var services = new ArrayList<NamedServiceDefinition>();
        collectDeepServices("", namespace, services);
        return services;
    }

    private static void collectDeepServices(String name, ProtoNode.Namespace namespace,
                                            List<NamedServiceDefinition> accumulator) {
        for (Map.Entry<String, ProtoNode> entry : namespace.getChildren().entrySet()) {
            var nameExtended = name.isEmpty() ? entry.getKey() : name + "." + entry.getKey();
            var node = entry.getValue();
            if (node instanceof ProtoNode.Service) {
                accumulator.add(NamedServiceDefinition.of(nameExtended, ((ProtoNode.Service) node).getDefinition()));
            } else {
                collectDeepServices(nameExtended, (ProtoNode.Namespace) node, accumulator);
            }
        }
    }
}
