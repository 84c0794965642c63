package org.example.remotefn.core.proxy;

import org.example.remotefn.api.VectorFunction;
import org.example.remotefn.common.entity.ColumnPage;
import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.enumeration.PageFormat;
import org.example.remotefn.common.enumeration.ResponseCode;
import org.example.remotefn.common.exception.FunctionNotFoundException;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.common.exception.ProtocolViolationException;
import org.example.remotefn.common.exception.RemoteExecutionException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.codec.ColumnBatchCodec;
import org.example.remotefn.core.config.RemoteCallOptions;
import org.example.remotefn.core.transport.RpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 远程函数在调用方的替身。
 * 对引擎来说它和本地函数一样实现 {@link VectorFunction}；内部把参数列编码，发给远端，
 * 再把结果列解码回来。调用线程会一直阻塞到响应到达或者传输失败，不做重试。
 */
public class RemoteFunctionAdapter implements VectorFunction {

    private static final Logger log = LoggerFactory.getLogger(RemoteFunctionAdapter.class);

    private static final AtomicLong REQUEST_IDS = new AtomicLong();

    private final String functionName;
    private final FunctionSignature signature;
    private final RpcClient client;
    private final RemoteCallOptions options;

    /**
     * @param functionName 服务端注册实现时用的名字（服务端会再加上自己的前缀）
     */
    public RemoteFunctionAdapter(String functionName, FunctionSignature signature,
                                 RemoteEndpoint endpoint, RemoteCallOptions options) {
        this(functionName, signature, new RpcClient(endpoint, options), options);
    }

    RemoteFunctionAdapter(String functionName, FunctionSignature signature,
                          RpcClient client, RemoteCallOptions options) {
        this.functionName = functionName;
        this.signature = signature;
        this.client = client;
        this.options = options;
    }

    @Override
    public ColumnVector apply(ColumnBatch arguments, ColumnType returnType) {
        // 空批次不需要走网络
        if (arguments.getRowCount() == 0) {
            return ColumnVector.empty(returnType);
        }

        WireRequest request = WireRequest.builder()
                .requestId(REQUEST_IDS.incrementAndGet())
                .functionName(functionName)
                .argumentTypes(signature.getArgumentTypes())
                .returnType(returnType)
                .inputs(ColumnPage.columnar(arguments.getRowCount(), ColumnBatchCodec.encode(arguments)))
                .throwOnError(options.isThrowOnError())
                .build();

        log.debug("调用远程函数 {}{} @ {}, rows={}", functionName, signature, client.getEndpoint(), arguments.getRowCount());
        WireResponse response = client.sendRequest(request);
        if (response == null) {
            throw new ProtocolViolationException("Empty response from " + client.getEndpoint());
        }
        if (!response.isSuccess()) {
            throw toException(response);
        }
        if (response.getRequestId() != request.getRequestId()) {
            throw new ProtocolViolationException("Response id " + response.getRequestId()
                    + " does not match request id " + request.getRequestId());
        }
        return readResult(response.getResult(), arguments.getRowCount(), returnType);
    }

    private RuntimeException toException(WireResponse response) {
        ResponseCode code = response.getCode() == null ? null : ResponseCode.fromCode(response.getCode());
        String message = response.getErrorMessage();
        if (code == null) {
            return new ProtocolViolationException("Unknown response code " + response.getCode() + ": " + message);
        }
        switch (code) {
            case FUNCTION_NOT_FOUND:
                return new FunctionNotFoundException(functionName, message);
            case EXECUTION_ERROR:
                return new RemoteExecutionException(message);
            case MALFORMED_PAYLOAD:
                return new ProtocolViolationException("Server rejected request payload: " + message);
            default:
                return new ProtocolViolationException("Unexpected response code " + code + ": " + message);
        }
    }

    private ColumnVector readResult(ColumnPage page, int expectedRows, ColumnType returnType) {
        if (page == null || page.getFormat() != PageFormat.COLUMNAR) {
            throw new ProtocolViolationException("Response from " + client.getEndpoint() + " carries no columnar result");
        }
        ColumnBatch batch;
        try {
            batch = ColumnBatchCodec.decode(page.getPayload());
        } catch (MalformedPayloadException e) {
            throw new ProtocolViolationException("Cannot decode result of " + functionName + ": " + e.getMessage(), e);
        }
        if (batch.getColumnCount() != 1) {
            throw new ProtocolViolationException("Expected one result column, got " + batch.getColumnCount());
        }
        ColumnVector result = batch.vector(0);
        if (batch.getRowCount() != expectedRows || page.getRowCount() != expectedRows) {
            throw new ProtocolViolationException("Function " + functionName + " returned " + batch.getRowCount()
                    + " rows for " + expectedRows + " input rows");
        }
        if (result.getType() != returnType) {
            throw new ProtocolViolationException("Function " + functionName + " returned "
                    + result.getType().getSqlName() + ", expected " + returnType.getSqlName());
        }
        return result;
    }
}
