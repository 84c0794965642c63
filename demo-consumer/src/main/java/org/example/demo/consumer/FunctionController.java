package org.example.demo.consumer;

import org.example.demo.consumer.dto.ColumnData;
import org.example.demo.consumer.dto.EvaluateRequest;
import org.example.remotefn.common.exception.FunctionNotFoundException;
import org.example.remotefn.common.exception.ProtocolViolationException;
import org.example.remotefn.common.exception.RemoteConnectionException;
import org.example.remotefn.common.exception.RemoteExecutionException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.registry.FunctionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class FunctionController {

    private static final Logger log = LoggerFactory.getLogger(FunctionController.class);

    private final FunctionCatalog catalog;

    public FunctionController(FunctionCatalog catalog) {
        this.catalog = catalog;
    }

    // 列出目录里所有函数及签名
    @GetMapping("/api/functions")
    public Map<String, Object> listFunctions() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String alias : catalog.aliases()) {
            List<String> signatures = new ArrayList<>();
            catalog.signatures(alias).forEach(s -> signatures.add(s.toString()));
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("remote", catalog.isRemote(alias));
            entry.put("signatures", signatures);
            result.put(alias, entry);
        }
        return result;
    }

    // 对一批参数列求值，例如 POST /api/functions/remote_plus/evaluate
    // {"arguments":[{"type":"bigint","values":[1,2,3]},{"type":"bigint","values":[1,2,3]}]}
    @PostMapping("/api/functions/{alias}/evaluate")
    public ColumnData evaluate(@PathVariable("alias") String alias, @RequestBody EvaluateRequest request) {
        ColumnBatch batch = toBatch(request);
        long start = System.currentTimeMillis();
        ColumnVector result = catalog.evaluate(alias, batch);
        log.info("【客户端】{} rows={} 耗时={}ms", alias, batch.getRowCount(), System.currentTimeMillis() - start);
        return new ColumnData(result.getType().getSqlName(), result.toList());
    }

    static ColumnBatch toBatch(EvaluateRequest request) {
        List<ColumnData> arguments = request.getArguments() == null ? List.of() : request.getArguments();
        ColumnVector[] vectors = new ColumnVector[arguments.size()];
        for (int i = 0; i < arguments.size(); i++) {
            ColumnData column = arguments.get(i);
            ColumnType type = ColumnType.fromSqlName(column.getType());
            List<Object> values = column.getValues() == null ? List.of() : column.getValues();
            List<Object> converted = new ArrayList<>(values.size());
            for (Object value : values) {
                converted.add(type.coerce(value));
            }
            vectors[i] = ColumnVector.of(type, converted);
        }
        return ColumnBatch.of(vectors);
    }

    // --- 把远程调用的错误翻译成 HTTP 状态码 ---

    @ExceptionHandler(RemoteConnectionException.class)
    public ResponseEntity<Map<String, Object>> onConnectionError(RemoteConnectionException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(FunctionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onFunctionNotFound(FunctionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(RemoteExecutionException.class)
    public ResponseEntity<Map<String, Object>> onExecutionError(RemoteExecutionException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(ProtocolViolationException.class)
    public ResponseEntity<Map<String, Object>> onProtocolViolation(ProtocolViolationException e) {
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        log.warn("【客户端】调用失败 ({}): {}", status.value(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
