package org.example.remotefn.common.exception;

import lombok.Getter;

/**
 * 服务端没有以该名字注册的实现。对调用方来说这也是一种执行错误，而不是连接错误。
 */
@Getter
public class FunctionNotFoundException extends RemoteExecutionException {

    private final String functionName;

    public FunctionNotFoundException(String functionName, String message) {
        super(message);
        this.functionName = functionName;
    }

    public FunctionNotFoundException(String functionName) {
        this(functionName, "Function not found: " + functionName);
    }
}
