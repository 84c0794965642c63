package org.example.remotefn.common.exception;

/**
 * 远端函数自己执行失败（比如除零），消息是服务端返回的原文
 */
public class RemoteExecutionException extends RemoteFunctionException {

    public RemoteExecutionException(String message) {
        super(message);
    }
}
