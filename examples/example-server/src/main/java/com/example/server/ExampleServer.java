package com.example.server;

import io.github.protobufx.grpc.dispatch.GrpcDispatchOptions;
import io.github.protobufx.grpc.dispatch.GrpcDispatchServer;
import io.github.protobufx.grpc.dispatch.definition.NamedServiceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@SpringBootApplication
public class ExampleServer {
    public static void main(String[] args) {
        SpringApplication.run(ExampleServer.class, args);
    }

    @Bean
    @ConfigurationProperties("grpc.dispatch")
    GrpcDispatchOptions grpcDispatchOptions() {
        var options = new GrpcDispatchOptions();
        options.setServiceDefinitions(List.of(
                NamedServiceDefinition.of("GreetService", GreetProtos.greetServiceDefinition())));
        return options;
    }

    @Bean
    GrpcDispatchServer grpcDispatchServer(GrpcDispatchOptions options, GreetController controller) {
        var server = new GrpcDispatchServer(options);
        server.addMethodHandler("GreetService", "Hello", controller::hello);
        server.addMethodHandler("GreetService", "Hi", controller::hi);
        return server;
    }

    @Bean
    GrpcDispatchServerLifecycle grpcDispatchServerLifecycle(GrpcDispatchServer server) {
        return new GrpcDispatchServerLifecycle(server);
    }

    /**
     * Starts the server with the application context and stops it on shutdown.
     */
    @Slf4j
    static class GrpcDispatchServerLifecycle implements SmartLifecycle {
        private final GrpcDispatchServer server;
        private volatile boolean running;

        GrpcDispatchServerLifecycle(GrpcDispatchServer server) {
            this.server = server;
        }

        @Override
        public void start() {
            try {
                server.start();
            } catch (IOException e) {
                throw new UncheckedIOException("Could not start gRPC server", e);
            }
            running = true;
            log.info("Example server ready on port {}", server.getPort());
        }

        @Override
        public void stop() {
            server.close();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }
}
