package org.example.remotefn.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * 客户端调用远程函数时的参数
 */
@Value
@Builder(toBuilder = true)
public class RemoteCallOptions {

    public static final RemoteCallOptions DEFAULT = RemoteCallOptions.builder().build();

    /**
     * 建立 TCP 连接的超时时间
     */
    @Builder.Default
    int connectTimeoutMillis = 3000;

    /**
     * 请求发出后等待响应的时间，超时按连接错误处理，服务端可能仍在计算
     */
    @Builder.Default
    long requestTimeoutMillis = 10_000;

    /**
     * 随请求发送，这一版服务端不处理
     */
    @Builder.Default
    boolean throwOnError = true;
}
