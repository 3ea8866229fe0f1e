package io.github.protobufx.grpc.dispatch.proto;

import com.google.common.io.Resources;
import com.google.protobuf.DescriptorProtos;
import com.google.protobuf.Descriptors;
import io.github.protobufx.grpc.dispatch.InvalidProtoDefinitionException;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads binary {@code FileDescriptorSet}s as written by {@code protoc --include_imports --descriptor_set_out}.
 * Paths starting with {@code classpath:} are read from the class path, others from the file system.
 */
@Slf4j
public class DescriptorSetProtoLoader implements ProtoLoader {
    static final String CLASSPATH_PREFIX = "classpath:";

    @Override
    public ProtoNode.Namespace load(List<String> protoPaths) {
        var protos = new LinkedHashMap<String, DescriptorProtos.FileDescriptorProto>();
        for (String path : protoPaths) {
            try {
                var descriptorSet = DescriptorProtos.FileDescriptorSet.parseFrom(read(path));
                descriptorSet.getFileList().forEach(file -> protos.putIfAbsent(file.getName(), file));
            } catch (IOException | IllegalArgumentException e) {
                var exception = new InvalidProtoDefinitionException(path, e);
                log.error(exception.getMessage(), e);
                throw exception;
            }
        }
        try {
            return toNamespace(new FileDescriptorResolver(protos).resolveAll());
        } catch (Descriptors.DescriptorValidationException | IllegalArgumentException e) {
            var exception = new InvalidProtoDefinitionException(String.join(",", protoPaths), e);
            log.error(exception.getMessage(), e);
            throw exception;
        }
    }

    /**
     * Builds the namespace tree of all services declared in the given files.
     */
    public static ProtoNode.Namespace toNamespace(Collection<Descriptors.FileDescriptor> files) {
        var root = ProtoNode.Namespace.root();
        for (Descriptors.FileDescriptor file : files) {
            for (Descriptors.ServiceDescriptor service : file.getServices()) {
                root.addService(file.getPackage(), service.getName(), GrpcServiceDefinition.of(service));
            }
        }
        return root;
    }

    static byte[] read(String path) throws IOException {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return Resources.toByteArray(Resources.getResource(path.substring(CLASSPATH_PREFIX.length())));
        }
        return Files.readAllBytes(Path.of(path));
    }

    static class FileDescriptorResolver {
        final Map<String, DescriptorProtos.FileDescriptorProto> fileMap;
        final Map<String, Descriptors.FileDescriptor> resolved = new HashMap<>();

        FileDescriptorResolver(Map<String, DescriptorProtos.FileDescriptorProto> fileMap) {
            this.fileMap = fileMap;
        }

        Collection<Descriptors.FileDescriptor> resolveAll() throws Descriptors.DescriptorValidationException {
            var files = new LinkedHashMap<String, Descriptors.FileDescriptor>();
            for (DescriptorProtos.FileDescriptorProto proto : fileMap.values()) {
                files.put(proto.getName(), resolve(proto));
            }
            return files.values();
        }

        Descriptors.FileDescriptor resolve(DescriptorProtos.FileDescriptorProto descriptorProto)
                throws Descriptors.DescriptorValidationException {
            var cached = resolved.get(descriptorProto.getName());
            if (cached != null) {
                return cached;
            }
            var dependencies = new Descriptors.FileDescriptor[descriptorProto.getDependencyCount()];
            for (int i = 0; i < dependencies.length; i++) {
                var dependencyName = descriptorProto.getDependency(i);
                var dependency = fileMap.get(dependencyName);
                if (dependency == null) {
                    throw new IllegalArgumentException("Could not find dependency: " + dependencyName);
                }
                dependencies[i] = resolve(dependency);
            }
            var fileDescriptor = Descriptors.FileDescriptor.buildFrom(descriptorProto, dependencies);
            resolved.put(descriptorProto.getName(), fileDescriptor);
            return fileDescriptor;
        }
    }
}
