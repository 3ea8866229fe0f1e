package io.github.protobufx.grpc.dispatch;

import com.google.protobuf.DynamicMessage;
import io.github.protobufx.grpc.dispatch.call.CallEvent;
import io.github.protobufx.grpc.dispatch.definition.NamedServiceDefinition;
import io.github.protobufx.grpc.dispatch.proto.DescriptorSetProtoLoader;
import io.grpc.CallOptions;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrpcDispatchServerTest {

    static final Metadata.Key<String> USER = Metadata.Key.of("x-user", Metadata.ASCII_STRING_MARSHALLER);

    final String serverName = InProcessServerBuilder.generateName();
    GrpcDispatchOptions options;
    GrpcDispatchServer server;
    ManagedChannel channel;

    @BeforeEach
    void beforeEach() {
        options = new GrpcDispatchOptions();
        options.setProtoPath(List.of("greet.pb"));
        options.setPackageNames(List.of("greet"));
        server = new GrpcDispatchServer(options,
                paths -> DescriptorSetProtoLoader.toNamespace(List.of(TestProtos.GREET_FILE, TestProtos.BUNDLE_FILE)),
                (opts, services) -> {
                    var builder = InProcessServerBuilder.forName(serverName);
                    services.forEach(builder::addService);
                    return builder.build();
                });
        channel = InProcessChannelBuilder.forName(serverName).build();
    }

    @AfterEach
    void afterEach() throws Exception {
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        server.close();
    }

    @Test
    @DisplayName("Unary call")
    void testUnary() throws Exception {
        server.addMethodHandler("GreetService", "Hello",
                (data, metadata, call) -> TestProtos.response("bill", "hello " + TestProtos.field(data, "to")));
        server.start();

        var response = ClientCalls.blockingUnaryCall(channel, TestProtos.greetMethod("Hello"),
                CallOptions.DEFAULT, TestProtos.request("world"));

        assertEquals("hello world", TestProtos.field(response, "reply"));
        assertEquals("bill", TestProtos.field(response, "from"));
    }

    @Test
    @DisplayName("Unary call - handler error")
    void testUnaryError() throws Exception {
        server.addMethodHandler("GreetService", "Hello", (data, metadata, call) -> {
            throw Status.PERMISSION_DENIED.withDescription("nope").asRuntimeException();
        });
        server.start();

        var exception = assertThrows(StatusRuntimeException.class, () -> ClientCalls.blockingUnaryCall(
                channel, TestProtos.greetMethod("Hello"), CallOptions.DEFAULT, TestProtos.request("world")));

        assertEquals(Status.Code.PERMISSION_DENIED, exception.getStatus().getCode());
        assertEquals("nope", exception.getStatus().getDescription());
    }

    @Test
    @DisplayName("Unary call - asynchronous result")
    void testUnaryAsync() throws Exception {
        server.addMethodHandler("GreetService", "Hi", (data, metadata, call) ->
                CompletableFuture.supplyAsync(() -> TestProtos.response("bill", "hi " + TestProtos.field(data, "to"))));
        server.start();

        var response = ClientCalls.blockingUnaryCall(channel, TestProtos.greetMethod("Hi"),
                CallOptions.DEFAULT, TestProtos.request("world"));

        assertEquals("hi world", TestProtos.field(response, "reply"));
    }

    @Test
    @DisplayName("Methods without a handler answer UNIMPLEMENTED")
    void testUnimplemented() throws Exception {
        server.addMethodHandler("GreetService", "Hello", (data, metadata, call) -> data);
        server.start();

        var exception = assertThrows(StatusRuntimeException.class, () -> ClientCalls.blockingUnaryCall(
                channel, TestProtos.greetMethod("Hi"), CallOptions.DEFAULT, TestProtos.request("world")));

        assertEquals(Status.Code.UNIMPLEMENTED, exception.getStatus().getCode());
    }

    @Test
    @DisplayName("Server streaming call")
    void testServerStreaming() throws Exception {
        server.addMethodHandler("GreetService", "HelloStream", (data, metadata, call) -> Flux.range(1, 20)
                .map(i -> TestProtos.response("bill", "hello " + TestProtos.field(data, "to") + " " + i)));
        server.start();

        var replies = new ArrayList<String>();
        ClientCalls.blockingServerStreamingCall(channel, TestProtos.greetMethod("HelloStream"),
                        CallOptions.DEFAULT, TestProtos.request("world"))
                .forEachRemaining(response -> replies.add(TestProtos.field(response, "reply")));

        assertEquals(20, replies.size());
        assertEquals("hello world 1", replies.get(0));
        assertEquals("hello world 20", replies.get(19));
    }

    @Test
    @DisplayName("Server streaming call - client reading one message at a time gets all messages in order")
    void testServerStreamingFlowControl() throws Exception {
        var drains = new AtomicInteger();
        server.addMethodHandler("GreetService", "HelloStream", (data, metadata, call) -> {
            call.on(CallEvent.DRAIN, payload -> drains.incrementAndGet());
            return Flux.range(1, 50).map(i -> TestProtos.response("bill", String.valueOf(i)));
        });
        server.start();

        var observer = new OneByOneObserver();
        ClientCalls.asyncServerStreamingCall(channel.newCall(TestProtos.greetMethod("HelloStream"), CallOptions.DEFAULT),
                TestProtos.request("world"), observer);

        observer.await();
        assertEquals(List.of(), observer.errors);
        assertEquals(IntStream.rangeClosed(1, 50).mapToObj(String::valueOf).collect(Collectors.toList()),
                observer.replies());
        assertTrue(drains.get() > 0, "call never reported being ready again");
    }

    @Test
    @DisplayName("Client streaming call - reactive handler")
    @SuppressWarnings("unchecked")
    void testClientStreaming() throws Exception {
        server.addStreamMethodHandler("GreetService", "Collect", (data, metadata, call) ->
                ((Flux<Object>) data)
                        .map(request -> TestProtos.field(request, "to"))
                        .collectList()
                        .map(names -> TestProtos.response("bill", "hello " + String.join(",", names))));
        server.start();

        var observer = new RecordingObserver();
        var requests = ClientCalls.asyncClientStreamingCall(
                channel.newCall(TestProtos.greetMethod("Collect"), CallOptions.DEFAULT), observer);
        requests.onNext(TestProtos.request("ann"));
        requests.onNext(TestProtos.request("bob"));
        requests.onCompleted();

        observer.await();
        assertEquals(List.of("hello ann,bob"), observer.replies());
        assertEquals(List.of(), observer.errors);
    }

    @Test
    @DisplayName("Client streaming call - pass-through handler")
    void testClientStreamingPassThrough() throws Exception {
        server.addStreamCallHandler("GreetService", "Collect", (call, callback) -> {
            var count = new int[1];
            call.on(CallEvent.DATA, message -> count[0]++);
            call.on(CallEvent.END, ignored ->
                    callback.onComplete(null, TestProtos.response("bill", "got " + count[0])));
        });
        server.start();

        var observer = new RecordingObserver();
        var requests = ClientCalls.asyncClientStreamingCall(
                channel.newCall(TestProtos.greetMethod("Collect"), CallOptions.DEFAULT), observer);
        requests.onNext(TestProtos.request("ann"));
        requests.onNext(TestProtos.request("bob"));
        requests.onNext(TestProtos.request("cid"));
        requests.onCompleted();

        observer.await();
        assertEquals(List.of("got 3"), observer.replies());
    }

    @Test
    @DisplayName("Bidirectional streaming call")
    @SuppressWarnings("unchecked")
    void testBidiStreaming() throws Exception {
        server.addStreamMethodHandler("GreetService", "Chat", (data, metadata, call) ->
                ((Flux<Object>) data).map(request -> TestProtos.response("bill", "hi " + TestProtos.field(request, "to"))));
        server.start();

        var observer = new RecordingObserver();
        var requests = ClientCalls.asyncBidiStreamingCall(
                channel.newCall(TestProtos.greetMethod("Chat"), CallOptions.DEFAULT), observer);
        requests.onNext(TestProtos.request("ann"));
        requests.onNext(TestProtos.request("bob"));
        requests.onCompleted();

        observer.await();
        assertEquals(List.of("hi ann", "hi bob"), observer.replies());
    }

    @Test
    @DisplayName("Request metadata reaches the handler")
    void testMetadata() throws Exception {
        server.addMethodHandler("GreetService", "Hello", (data, metadata, call) ->
                TestProtos.response(metadata.get(USER), "hello"));
        server.start();
        var headers = new Metadata();
        headers.put(USER, "ann");

        var response = ClientCalls.blockingUnaryCall(
                ClientInterceptors.intercept(channel, MetadataUtils.newAttachHeadersInterceptor(headers)),
                TestProtos.greetMethod("Hello"), CallOptions.DEFAULT, TestProtos.request("world"));

        assertEquals("ann", TestProtos.field(response, "from"));
    }

    @Test
    @DisplayName("Handler registered with a JSON pattern")
    void testJsonPattern() throws Exception {
        server.addHandler("{\"service\":\"GreetService\",\"rpc\":\"hello\",\"streaming\":\"no_stream\"}",
                (data, metadata, call) -> TestProtos.response("bill", "json"));
        server.start();

        var response = ClientCalls.blockingUnaryCall(channel, TestProtos.greetMethod("Hello"),
                CallOptions.DEFAULT, TestProtos.request("world"));

        assertEquals("json", TestProtos.field(response, "reply"));
    }

    @Test
    @DisplayName("Services from sub packages are served under their relative name")
    void testSubPackage() {
        options.setPackageNames(List.of("bundle"));
        server.addMethodHandler("first.Events", "Publish", (data, metadata, call) -> data);
        server.addMethodHandler("Audit", "Record", (data, metadata, call) -> data);

        var services = server.bindEvents();

        assertEquals(List.of("bundle.first.Events"), services.stream()
                .map(service -> service.getServiceDescriptor().getName())
                .collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Explicit service definitions are served without loading protos")
    void testExplicitServiceDefinitions() throws Exception {
        options.setPackageNames(List.of());
        options.setServiceDefinitions(List.of(NamedServiceDefinition.of("Greeter", TestProtos.greetServiceDefinition())));
        server = new GrpcDispatchServer(options,
                paths -> {
                    throw new AssertionError("protos must not be loaded");
                },
                (opts, services) -> {
                    var builder = InProcessServerBuilder.forName(serverName);
                    services.forEach(builder::addService);
                    return builder.build();
                });
        server.addMethodHandler("Greeter", "Hello", (data, metadata, call) -> TestProtos.response("bill", "explicit"));
        server.start();

        DynamicMessage response = ClientCalls.blockingUnaryCall(channel, TestProtos.greetMethod("Hello"),
                CallOptions.DEFAULT, TestProtos.request("world"));

        assertEquals("explicit", TestProtos.field(response, "reply"));
    }

    @Test
    @DisplayName("Unknown package")
    void testInvalidPackage() {
        options.setPackageNames(List.of("greet", "unknown"));

        var exception = assertThrows(InvalidGrpcPackageException.class, () -> server.start());

        assertEquals("unknown", exception.getPackageName());
    }

    @Test
    @DisplayName("A service is not a package")
    void testServiceAsPackage() {
        options.setPackageNames(List.of("greet.GreetService"));

        assertThrows(InvalidGrpcPackageException.class, () -> server.start());
    }

    @Test
    @DisplayName("Handlers cannot be added after start")
    void testAddHandlerAfterStart() throws Exception {
        server.start();

        assertThrows(IllegalStateException.class,
                () -> server.addMethodHandler("GreetService", "Hello", (data, metadata, call) -> data));
    }

    @Test
    @DisplayName("Graceful close")
    void testGracefulClose() throws Exception {
        options.setGracefulShutdown(true);
        server.addMethodHandler("GreetService", "Hello", (data, metadata, call) -> data);
        server.start();

        server.close();

        var exception = assertThrows(StatusRuntimeException.class, () -> ClientCalls.blockingUnaryCall(
                channel, TestProtos.greetMethod("Hello"), CallOptions.DEFAULT, TestProtos.request("world")));
        assertEquals(Status.Code.UNAVAILABLE, exception.getStatus().getCode());
    }

    static class OneByOneObserver extends RecordingObserver
            implements ClientResponseObserver<DynamicMessage, DynamicMessage> {
        ClientCallStreamObserver<DynamicMessage> requestStream;

        @Override
        public void beforeStart(ClientCallStreamObserver<DynamicMessage> requestStream) {
            this.requestStream = requestStream;
            requestStream.disableAutoRequestWithInitial(1);
        }

        @Override
        public void onNext(DynamicMessage value) {
            super.onNext(value);
            requestStream.request(1);
        }
    }

    static class RecordingObserver implements StreamObserver<DynamicMessage> {
        final List<DynamicMessage> values = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final CountDownLatch done = new CountDownLatch(1);

        @Override
        public void onNext(DynamicMessage value) {
            values.add(value);
        }

        @Override
        public void onError(Throwable t) {
            errors.add(t);
            done.countDown();
        }

        @Override
        public void onCompleted() {
            done.countDown();
        }

        void await() throws InterruptedException {
            assertTrue(done.await(5, TimeUnit.SECONDS), "call did not finish");
        }

        List<String> replies() {
            return values.stream().map(value -> TestProtos.field(value, "reply")).collect(Collectors.toList());
        }
    }
}
