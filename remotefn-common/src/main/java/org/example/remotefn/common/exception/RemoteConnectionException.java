package org.example.remotefn.common.exception;

import lombok.Getter;
import org.example.remotefn.common.entity.RemoteEndpoint;

/**
 * 请求没能到达服务端：连接被拒绝、被重置或者超时。
 * 消息里保留底层传输的原始描述（例如 "Connection refused"），方便排查和匹配。
 */
@Getter
public class RemoteConnectionException extends RemoteFunctionException {

    private final RemoteEndpoint endpoint;
    private final boolean timeout;

    public RemoteConnectionException(RemoteEndpoint endpoint, String transportMessage, Throwable cause) {
        this(endpoint, transportMessage, false, cause);
    }

    public RemoteConnectionException(RemoteEndpoint endpoint, String transportMessage, boolean timeout, Throwable cause) {
        super("Remote function call to " + endpoint + " failed: " + transportMessage, cause);
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    public static RemoteConnectionException timedOut(RemoteEndpoint endpoint, long timeoutMillis) {
        return new RemoteConnectionException(endpoint,
                "no response within " + timeoutMillis + " ms (timeout)", true, null);
    }
}
