package com.example.server;

import com.google.protobuf.DynamicMessage;
import com.google.protobuf.util.JsonFormat;
import io.github.protobufx.grpc.dispatch.call.GrpcCall;
import io.grpc.Metadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class GreetController {
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer().omittingInsignificantWhitespace();

    public Object hello(Object data, Metadata metadata, GrpcCall<Object, Object> call) throws Exception {
        var request = (DynamicMessage) data;
        log.info("hello {}", PRINTER.print(request));
        return GreetProtos.response("bill", "hello " + GreetProtos.to(request));
    }

    public Object hi(Object data, Metadata metadata, GrpcCall<Object, Object> call) throws Exception {
        var request = (DynamicMessage) data;
        log.info("hi {}", PRINTER.print(request));
        return GreetProtos.response("bill", "hi " + GreetProtos.to(request));
    }
}
