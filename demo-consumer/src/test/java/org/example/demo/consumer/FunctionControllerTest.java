package org.example.demo.consumer;

import org.example.demo.consumer.dto.ColumnData;
import org.example.demo.consumer.dto.EvaluateRequest;
import org.example.demo.provider.ProviderApp;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.exception.FunctionNotFoundException;
import org.example.remotefn.common.exception.ProtocolViolationException;
import org.example.remotefn.common.exception.RemoteConnectionException;
import org.example.remotefn.common.exception.RemoteExecutionException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.core.config.RemoteCallOptions;
import org.example.remotefn.core.transport.RpcServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionControllerTest {

    private static RpcServer server;
    private static FunctionController controller;

    @BeforeAll
    static void startProvider() throws Exception {
        server = ProviderApp.createServer("127.0.0.1", 0);
        server.start();
        controller = new FunctionController(RemoteFunctionConfig.createCatalog(
                RemoteEndpoint.of("127.0.0.1", server.getPort()), RemoteCallOptions.DEFAULT));
    }

    @AfterAll
    static void stopProvider() {
        server.shutdown();
    }

    @Test
    void evaluatesRemotePlus() {
        EvaluateRequest request = new EvaluateRequest(List.of(
                new ColumnData("bigint", List.of(1, 2, 3, 4, 5)),
                new ColumnData("bigint", List.of(1, 2, 3, 4, 5))));

        ColumnData result = controller.evaluate("remote_plus", request);

        assertThat(result.getType()).isEqualTo("bigint");
        assertThat(result.getValues()).containsExactly(2L, 4L, 6L, 8L, 10L);
    }

    @Test
    void evaluatesRemoteSubstrWithNulls() {
        EvaluateRequest request = new EvaluateRequest(List.of(
                new ColumnData("varchar", Arrays.asList("hello", null, "remote", "world")),
                new ColumnData("integer", Arrays.asList(2, 1, 3, 5))));

        ColumnData result = controller.evaluate("remote_substr", request);

        assertThat(result.getType()).isEqualTo("varchar");
        assertThat(result.getValues()).containsExactly("ello", null, "mote", "d");
    }

    @Test
    void listsRegisteredFunctions() {
        Map<String, Object> functions = controller.listFunctions();

        assertThat(functions).containsOnlyKeys("remote_divide", "remote_plus", "remote_substr");
        assertThat(functions.get("remote_plus").toString()).contains("remote=true", "(bigint, bigint) -> bigint");
    }

    @Test
    void remoteErrorBecomesUnprocessableEntity() {
        EvaluateRequest request = new EvaluateRequest(List.of(
                new ColumnData("double", List.of(1.0)),
                new ColumnData("double", List.of(0.0))));

        assertThatThrownBy(() -> controller.evaluate("remote_divide", request))
                .isInstanceOfSatisfying(RemoteExecutionException.class, e -> {
                    ResponseEntity<Map<String, Object>> response = controller.onExecutionError(e);
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(response.getBody()).containsEntry("message", "division by zero");
                });
    }

    @Test
    void unknownAliasIsBadRequest() {
        EvaluateRequest request = new EvaluateRequest(List.of(new ColumnData("bigint", List.of(1))));

        assertThatThrownBy(() -> controller.evaluate("nope", request))
                .isInstanceOfSatisfying(IllegalArgumentException.class, e ->
                        assertThat(controller.onBadRequest(e).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void convertsJsonNumbersToColumnTypes() {
        EvaluateRequest request = new EvaluateRequest(List.of(
                new ColumnData("BIGINT", Arrays.asList(1, null, "3")),
                new ColumnData("double", List.of(1, 2.5, 3))));

        ColumnBatch batch = FunctionController.toBatch(request);

        assertThat(batch.columnTypes()).containsExactly(ColumnType.BIGINT, ColumnType.DOUBLE);
        assertThat(batch.vector(0).toList()).containsExactly(1L, null, 3L);
        assertThat(batch.vector(1).toList()).containsExactly(1.0, 2.5, 3.0);
    }

    @Test
    void outOfRangeInputIsBadRequest() {
        EvaluateRequest request = new EvaluateRequest(List.of(
                new ColumnData("integer", List.of(3_000_000_000L)),
                new ColumnData("integer", List.of(1))));

        assertThatThrownBy(() -> controller.evaluate("remote_plus", request))
                .isInstanceOfSatisfying(IllegalArgumentException.class, e -> {
                    assertThat(e).hasMessageContaining("does not fit integer");
                    assertThat(controller.onBadRequest(e).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                });
        assertThatThrownBy(() -> FunctionController.toBatch(new EvaluateRequest(List.of(
                new ColumnData("bigint", List.of(1.5))))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapsErrorsToStatuses() {
        RemoteEndpoint endpoint = RemoteEndpoint.of("127.0.0.1", 1);

        assertThat(controller.onConnectionError(new RemoteConnectionException(endpoint, "Connection refused", null))
                .getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(controller.onFunctionNotFound(new FunctionNotFoundException("x")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(controller.onProtocolViolation(new ProtocolViolationException("bad frame")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }
}
