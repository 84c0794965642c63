package org.example.remotefn.core.transport;

import org.example.remotefn.api.RowByRowFunction;
import org.example.remotefn.common.entity.ColumnPage;
import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.enumeration.ResponseCode;
import org.example.remotefn.common.exception.RemoteConnectionException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.codec.ColumnBatchCodec;
import org.example.remotefn.core.codec.CommonEncoder;
import org.example.remotefn.core.registry.FunctionRegistry;
import org.example.remotefn.core.service.RemoteFunctionService;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcServerTest {

    private final RemoteFunctionService service = new RemoteFunctionService(FunctionRegistry.builder().build(), "remote");

    @Test
    void bindsOsAssignedPortAndReleasesItOnShutdown() throws Exception {
        RpcServer server = new RpcServer("127.0.0.1", 0, service);
        assertThat(server.isServing()).isFalse();
        assertThat(server.getPort()).isEqualTo(-1);

        server.start();
        int port = server.getPort();
        assertThat(server.isServing()).isTrue();
        assertThat(port).isPositive();

        server.shutdown();
        assertThat(server.isServing()).isFalse();
        // 端口已经释放，可以重新绑定
        try (ServerSocket socket = new ServerSocket(port)) {
            assertThat(socket.getLocalPort()).isEqualTo(port);
        }
    }

    @Test
    void shutdownLetsInFlightCallFinish() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        FunctionSignature slowIdentity = FunctionSignature.builder()
                .returnType(ColumnType.BIGINT).argumentType(ColumnType.BIGINT).build();
        RemoteFunctionService slow = new RemoteFunctionService(FunctionRegistry.builder()
                .register("remote.slow", slowIdentity, RowByRowFunction.of(args -> {
                    started.countDown();
                    try {
                        Thread.sleep(500);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                    return args[0];
                }))
                .build(), "remote");
        RpcServer server = new RpcServer("127.0.0.1", 0, slow);
        server.start();
        int port = server.getPort();

        ColumnBatch batch = ColumnBatch.of(ColumnVector.ofLongs(7));
        WireRequest request = WireRequest.builder()
                .requestId(3)
                .functionName("slow")
                .inputs(ColumnPage.columnar(1, ColumnBatchCodec.encode(batch)))
                .build();
        CompletableFuture<WireResponse> call = CompletableFuture.supplyAsync(
                () -> new RpcClient(RemoteEndpoint.of("127.0.0.1", port)).sendRequest(request));

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        server.shutdown();

        WireResponse response = call.get(5, TimeUnit.SECONDS);
        assertThat(response.getCode()).isEqualTo(ResponseCode.SUCCESS.getCode());
        assertThat(ColumnBatchCodec.decode(response.getResult().getPayload()).vector(0))
                .isEqualTo(ColumnVector.ofLongs(7));
        assertThat(server.isServing()).isFalse();
    }

    @Test
    void answersUnknownFunctionOverTheWire() throws Exception {
        RpcServer server = new RpcServer("127.0.0.1", 0, service);
        server.start();
        try {
            ColumnBatch batch = ColumnBatch.of(ColumnVector.ofLongs(1));
            WireRequest request = WireRequest.builder()
                    .requestId(9)
                    .functionName("nope")
                    .inputs(ColumnPage.columnar(1, ColumnBatchCodec.encode(batch)))
                    .build();

            WireResponse response = new RpcClient(RemoteEndpoint.of("127.0.0.1", server.getPort())).sendRequest(request);

            assertThat(response.getRequestId()).isEqualTo(9);
            assertThat(response.getCode()).isEqualTo(ResponseCode.FUNCTION_NOT_FOUND.getCode());
            assertThat(response.getErrorMessage()).contains("remote.nope");
        } finally {
            server.shutdown();
        }
    }

    @Test
    void survivesGarbageBodyAndKeepsServing() throws Exception {
        RpcServer server = new RpcServer("127.0.0.1", 0, service);
        server.start();
        try (Socket socket = new Socket("127.0.0.1", server.getPort())) {
            byte[] body = "{\"requestId\": [oops".getBytes(StandardCharsets.UTF_8);
            DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            out.writeInt(CommonEncoder.MAGIC_NUMBER);
            out.writeByte(CommonEncoder.PROTOCOL_VERSION);
            out.writeByte(1);
            out.writeByte(CommonEncoder.REQUEST_TYPE);
            out.writeInt(body.length);
            out.write(body);
            out.flush();

            DataInputStream in = new DataInputStream(socket.getInputStream());
            assertThat(in.readInt()).isEqualTo(CommonEncoder.MAGIC_NUMBER);
            in.readByte();
            in.readByte();
            assertThat(in.readByte()).isEqualTo(CommonEncoder.RESPONSE_TYPE);
            byte[] responseBody = new byte[in.readInt()];
            in.readFully(responseBody);
            assertThat(new String(responseBody, StandardCharsets.UTF_8)).contains("\"code\":400");

            assertThat(server.isServing()).isTrue();
        } finally {
            server.shutdown();
        }
    }

    @Test
    void refusesToStartTwiceAndFailsOnTakenPort() throws Exception {
        RpcServer server = new RpcServer("127.0.0.1", 0, service);
        server.start();
        try {
            assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);

            RpcServer clash = new RpcServer("127.0.0.1", server.getPort(), service);
            assertThatThrownBy(clash::start)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Cannot bind");
            assertThat(clash.isServing()).isFalse();
        } finally {
            server.shutdown();
        }
    }

    @Test
    void clientReportsConnectionRefused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        RpcClient client = new RpcClient(RemoteEndpoint.of("127.0.0.1", port));
        WireRequest request = WireRequest.builder().requestId(1).functionName("plus").build();

        assertThatThrownBy(() -> client.sendRequest(request))
                .isInstanceOf(RemoteConnectionException.class)
                .hasMessageContaining("Connection refused")
                .hasMessageContaining("127.0.0.1:" + port);
    }
}
