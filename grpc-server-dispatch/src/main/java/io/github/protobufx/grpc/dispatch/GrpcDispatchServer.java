package io.github.protobufx.grpc.dispatch;

import io.github.protobufx.grpc.dispatch.call.GrpcStreamWriter;
import io.github.protobufx.grpc.dispatch.call.ServiceMethodFactory;
import io.github.protobufx.grpc.dispatch.definition.GrpcServiceDefinition;
import io.github.protobufx.grpc.dispatch.definition.NamedServiceDefinition;
import io.github.protobufx.grpc.dispatch.definition.ServerServiceDefinitionFactory;
import io.github.protobufx.grpc.dispatch.proto.DescriptorSetProtoLoader;
import io.github.protobufx.grpc.dispatch.proto.ProtoLoader;
import io.github.protobufx.grpc.dispatch.proto.ProtoNode;
import io.github.protobufx.grpc.dispatch.proto.ProtoServiceCollector;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;

/**
 * gRPC server serving proto-defined services with handlers registered by pattern.
 *
 * <pre>{@code
 * var options = new GrpcDispatchOptions();
 * options.setProtoPath(List.of("classpath:greet.pb"));
 * options.setPackageNames(List.of("greet"));
 * var server = new GrpcDispatchServer(options);
 * server.addMethodHandler("GreetService", "Hello", (request, metadata, call) -> reply(request));
 * server.start();
 * }</pre>
 *
 * Handlers must be registered before {@link #start()}.
 */
@Slf4j
public class GrpcDispatchServer {
    private final GrpcDispatchOptions options;
    private final ProtoLoader protoLoader;
    private final GrpcServerFactory serverFactory;
    private final MessageHandlerRegistry registry = new MessageHandlerRegistry();
    private final ServiceBinder serviceBinder;
    private final ServerServiceDefinitionFactory serverServiceDefinitionFactory = new ServerServiceDefinitionFactory();
    private Server grpcServer;

    public GrpcDispatchServer(GrpcDispatchOptions options) {
        this(options, new DescriptorSetProtoLoader(), new NettyGrpcServerFactory());
    }

    public GrpcDispatchServer(GrpcDispatchOptions options, ProtoLoader protoLoader, GrpcServerFactory serverFactory) {
        this.options = options;
        this.protoLoader = protoLoader;
        this.serverFactory = serverFactory;
        this.serviceBinder = new ServiceBinder(registry,
                new ServiceMethodFactory(new GrpcStreamWriter(), options.getCancellationPolicy()));
    }

    public void addHandler(GrpcPattern pattern, MessageHandler handler) {
        checkState(grpcServer == null, "Handlers must be added before the server starts");
        registry.register(pattern, handler);
    }

    /**
     * Registers a handler under a pattern in its JSON form, see {@link GrpcPattern#parse(String)}.
     */
    public void addHandler(String pattern, MessageHandler handler) {
        addHandler(GrpcPattern.parse(pattern), handler);
    }

    public void addMethodHandler(String service, String rpc, MessageHandler handler) {
        addHandler(GrpcPattern.of(service, rpc, GrpcMethodStreamingType.NO_STREAMING), handler);
    }

    public void addStreamMethodHandler(String service, String rpc, MessageHandler handler) {
        addHandler(GrpcPattern.of(service, rpc, GrpcMethodStreamingType.RX_STREAMING), handler);
    }

    public void addStreamCallHandler(String service, String rpc, StreamCallHandler handler) {
        addHandler(GrpcPattern.of(service, rpc, GrpcMethodStreamingType.PT_STREAMING), handler);
    }

    /**
     * Binds all services and starts listening.
     *
     * @throws InvalidProtoDefinitionException if the proto definitions cannot be loaded
     * @throws InvalidGrpcPackageException if a configured package does not exist
     * @throws IOException if the server cannot bind
     */
    public synchronized void start() throws IOException {
        checkState(grpcServer == null, "Server already started");
        var server = serverFactory.create(options, bindEvents());
        server.start();
        grpcServer = server;
        log.info("gRPC server listening on {}", server.getListenSockets());
    }

    List<ServerServiceDefinition> bindEvents() {
        var services = new ArrayList<ServerServiceDefinition>();
        if (!options.getPackageNames().isEmpty()) {
            var root = protoLoader.load(options.getProtoPath());
            for (String packageName : options.getPackageNames()) {
                createServices(root, packageName, services);
            }
        }
        for (NamedServiceDefinition definition : options.getServiceDefinitions()) {
            addService(createService(definition.getService(), definition.getName()), services);
        }
        return services;
    }

    /**
     * Maps the methods of a service definition to the registered handlers.
     */
    public ServiceBinding createService(GrpcServiceDefinition service, String name) {
        return serviceBinder.bind(name, service);
    }

    public List<NamedServiceDefinition> getServiceNames(ProtoNode.Namespace namespace) {
        return ProtoServiceCollector.getServiceNames(namespace);
    }

    private void createServices(ProtoNode.Namespace root, String packageName, List<ServerServiceDefinition> services) {
        var node = ProtoServiceCollector.lookupPackage(root, packageName);
        if (!(node instanceof ProtoNode.Namespace)) {
            var exception = new InvalidGrpcPackageException(packageName);
            log.error(exception.getMessage(), exception);
            throw exception;
        }
        for (NamedServiceDefinition definition : getServiceNames((ProtoNode.Namespace) node)) {
            addService(createService(definition.getService(), definition.getName()), services);
        }
    }

    private void addService(ServiceBinding binding, List<ServerServiceDefinition> services) {
        if (binding.getMethods().isEmpty()) {
            log.info("No handlers for service {}, not served", binding.getService().getFullName());
            return;
        }
        log.info("Serving {} as {} with methods {}",
                binding.getService().getFullName(), binding.getName(), binding.getMethods().keySet());
        services.add(serverServiceDefinitionFactory.create(binding));
    }

    public synchronized int getPort() {
        checkState(grpcServer != null, "Server not started");
        return grpcServer.getPort();
    }

    public void awaitTermination() throws InterruptedException {
        Server server;
        synchronized (this) {
            server = grpcServer;
        }
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * Stops the server. With {@link GrpcDispatchOptions#isGracefulShutdown()} in-flight calls get up to
     * {@link GrpcDispatchOptions#getGracefulShutdownTimeout()} to finish before they are cancelled.
     */
    public synchronized void close() {
        if (grpcServer == null) {
            return;
        }
        var server = grpcServer;
        grpcServer = null;
        if (!options.isGracefulShutdown()) {
            server.shutdownNow();
            log.info("gRPC server stopped");
            return;
        }
        server.shutdown();
        try {
            var timeout = options.getGracefulShutdownTimeout();
            if (!server.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("gRPC server did not terminate within {}, cancelling remaining calls", timeout);
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdownNow();
        }
        log.info("gRPC server stopped");
    }
}
