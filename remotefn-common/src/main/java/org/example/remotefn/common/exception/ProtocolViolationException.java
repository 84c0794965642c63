package org.example.remotefn.common.exception;

/**
 * 响应的形状不符合约定（行数不对、类型不对、解不开等），只在客户端产生，不重试
 */
public class ProtocolViolationException extends RemoteFunctionException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
