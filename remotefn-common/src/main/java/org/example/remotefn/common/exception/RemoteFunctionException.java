package org.example.remotefn.common.exception;

/**
 * 远程函数调用中所有错误的父类。
 * 都是单次调用级别的错误，不会影响服务端或者调用方的其他调用。
 */
public class RemoteFunctionException extends RuntimeException {

    public RemoteFunctionException(String message) {
        super(message);
    }

    public RemoteFunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
