package org.example.remotefn.core.service;

import org.example.remotefn.common.entity.ColumnPage;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.enumeration.PageFormat;
import org.example.remotefn.common.enumeration.ResponseCode;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.codec.ColumnBatchCodec;
import org.example.remotefn.core.registry.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 远程函数服务端逻辑：解码参数 -> 查分发表 -> 执行 -> 编码结果。
 * <p>
 * 单次调用的任何失败（解码失败、函数不存在、函数抛异常）都变成失败的 WireResponse 返回，
 * 不会往外抛，也不会影响其他调用。本类没有可变状态，可以被多个线程同时调用。
 */
public class RemoteFunctionService {

    private static final Logger log = LoggerFactory.getLogger(RemoteFunctionService.class);

    static final String RESULT_COLUMN = "result";

    private final FunctionRegistry registry;
    private final String functionPrefix;

    /**
     * @param functionPrefix 查表时加在请求函数名前面的前缀（"remote" -> "remote.plus"），为空则不加
     */
    public RemoteFunctionService(FunctionRegistry registry, String functionPrefix) {
        this.registry = registry;
        this.functionPrefix = functionPrefix == null ? "" : functionPrefix;
    }

    public RemoteFunctionService(FunctionRegistry registry) {
        this(registry, "");
    }

    public WireResponse invoke(WireRequest request) {
        long requestId = request.getRequestId();

        // 1. 解码参数
        ColumnBatch arguments;
        try {
            arguments = decodeInputs(request.getInputs());
        } catch (MalformedPayloadException e) {
            log.warn("请求 {} 的参数无法解码: {}", requestId, e.getMessage());
            return WireResponse.fail(requestId, ResponseCode.MALFORMED_PAYLOAD, e.getMessage());
        }

        // 2. 查找实现
        String qualifiedName = qualify(request.getFunctionName());
        List<ColumnType> argumentTypes = arguments.columnTypes();
        FunctionRegistry.Entry entry = registry.lookup(qualifiedName, argumentTypes);
        if (entry == null) {
            String message = registry.contains(qualifiedName)
                    ? "Function not found: " + qualifiedName + " has no overload for " + describe(argumentTypes)
                        + ", available: " + registry.signatures(qualifiedName)
                    : "Function not found: " + qualifiedName;
            log.warn("请求 {}: {}", requestId, message);
            return WireResponse.fail(requestId, ResponseCode.FUNCTION_NOT_FOUND, message);
        }
        ColumnType returnType = entry.getSignature().getReturnType();
        if (request.getReturnType() != null && request.getReturnType() != returnType) {
            log.debug("请求 {} 期望返回 {}，服务端签名为 {}", requestId, request.getReturnType(), entry.getSignature());
        }

        // 3. 执行，函数自身的异常在这里截住
        log.debug("服务端收到调用: {}{} rows={}", qualifiedName, entry.getSignature(), arguments.getRowCount());
        ColumnVector result;
        try {
            result = entry.getFunction().apply(arguments, returnType);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            log.warn("函数 {} 执行失败: {}", qualifiedName, message);
            return WireResponse.fail(requestId, ResponseCode.EXECUTION_ERROR, message);
        }
        if (result == null || result.size() != arguments.getRowCount()) {
            String message = "Function " + qualifiedName + " returned "
                    + (result == null ? "no result" : result.size() + " rows")
                    + " for " + arguments.getRowCount() + " input rows";
            log.warn(message);
            return WireResponse.fail(requestId, ResponseCode.EXECUTION_ERROR, message);
        }
        if (result.getType() != returnType) {
            String message = "Function " + qualifiedName + " returned " + result.getType().getSqlName()
                    + ", signature declares " + returnType.getSqlName();
            log.warn(message);
            return WireResponse.fail(requestId, ResponseCode.EXECUTION_ERROR, message);
        }

        // 4. 编码结果
        ColumnBatch output = new ColumnBatch(result.size(), List.of(new ColumnBatch.Column(RESULT_COLUMN, result)));
        return WireResponse.success(requestId, ColumnPage.columnar(output.getRowCount(), ColumnBatchCodec.encode(output)));
    }

    private String qualify(String functionName) {
        String name = functionName == null ? "" : functionName;
        return functionPrefix.isEmpty() ? name : functionPrefix + "." + name;
    }

    private static ColumnBatch decodeInputs(ColumnPage page) {
        if (page == null) {
            throw new MalformedPayloadException("Request carries no input page");
        }
        if (page.getFormat() != PageFormat.COLUMNAR) {
            throw new MalformedPayloadException("Unsupported page format " + page.getFormat());
        }
        ColumnBatch batch = ColumnBatchCodec.decode(page.getPayload());
        if (batch.getRowCount() != page.getRowCount()) {
            throw new MalformedPayloadException("Page declares " + page.getRowCount()
                    + " rows, payload holds " + batch.getRowCount());
        }
        return batch;
    }

    private static String describe(List<ColumnType> types) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(types.get(i).getSqlName());
        }
        return sb.append(')').toString();
    }
}
