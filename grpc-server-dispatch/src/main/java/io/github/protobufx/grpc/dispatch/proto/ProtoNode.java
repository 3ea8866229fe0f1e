package io.github.protobufx.grpc.dispatch.proto;

import com.google.common.base.Splitter;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the tree of loaded proto definitions: either a namespace (package segment) or a service.
 */
public interface ProtoNode {

    @EqualsAndHashCode
    @ToString
    final class Namespace implements ProtoNode {
        private final Map<String, ProtoNode> children = new LinkedHashMap<>();

        public static Namespace root() {
            return new Namespace();
        }

        public Map<String, ProtoNode> getChildren() {
            return Collections.unmodifiableMap(children);
        }

        @Nullable
        public ProtoNode get(String name) {
            return children.get(name);
        }

        /**
         * Places a service under the namespace path given by a dotted package name, creating namespaces on the way.
         */
        public Namespace addService(String packageName, String serviceName, GrpcServiceDefinition service) {
            Namespace namespace = this;
            if (!packageName.isEmpty()) {
                for (String segment : Splitter.on('.').split(packageName)) {
                    namespace = namespace.namespace(segment);
                }
            }
            namespace.children.put(serviceName, new Service(service));
            return this;
        }

        private Namespace namespace(String name) {
            var child = children.get(name);
            if (child instanceof Namespace) {
                return (Namespace) child;
            }
            if (child != null) {
                throw new IllegalArgumentException("Namespace '" + name + "' clashes with a service of the same name");
            }
            var namespace = new Namespace();
            children.put(name, namespace);
            return namespace;
        }
    }

    @EqualsAndHashCode
    @ToString
    final class Service implements ProtoNode {
        private final GrpcServiceDefinition definition;

        public Service(GrpcServiceDefinition definition) {
            this.definition = definition;
        }

        public GrpcServiceDefinition getDefinition() {
            return definition;
        }
    }
}
