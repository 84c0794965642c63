package org.example.remotefn.common.exception;

/**
 * 收到的字节无法解码：被截断、长度和行数对不上、类型标签不认识等
 */
public class MalformedPayloadException extends RemoteFunctionException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
