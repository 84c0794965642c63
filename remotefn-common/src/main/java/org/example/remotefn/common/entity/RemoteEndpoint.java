package org.example.remotefn.common.entity;

import lombok.Value;

/**
 * 远程函数服务的地址
 */
@Value
public class RemoteEndpoint {

    String host;
    int port;

    public RemoteEndpoint(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.host = host;
        this.port = port;
    }

    public static RemoteEndpoint of(String host, int port) {
        return new RemoteEndpoint(host, port);
    }

    @Override
    public String toString() {
        // IPv6 字面量要加方括号，比如 [::1]:9999
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            return "[" + host + "]:" + port;
        }
        return host + ":" + port;
    }
}
