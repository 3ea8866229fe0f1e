package io.github.protobufx.grpc.dispatch;

import com.google.common.net.HostAndPort;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * Netty server bound to {@link GrpcDispatchOptions#getUrl()}.
 */
public class NettyGrpcServerFactory implements GrpcServerFactory {
    static final int DEFAULT_PORT = 5000;

    @Override
    public Server create(GrpcDispatchOptions options, List<ServerServiceDefinition> services) {
        var hostAndPort = HostAndPort.fromString(options.getUrl()).withDefaultPort(DEFAULT_PORT);
        var credentials = options.getCredentials() == null
                ? InsecureServerCredentials.create() : options.getCredentials();
        var builder = NettyServerBuilder.forAddress(
                new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort()), credentials);
        if (options.getMaxReceiveMessageLength() != null) {
            builder.maxInboundMessageSize(options.getMaxReceiveMessageLength());
        }
        if (options.getMaxMetadataSize() != null) {
            builder.maxInboundMetadataSize(options.getMaxMetadataSize());
        }
        services.forEach(builder::addService);
        return builder.build();
    }
}
