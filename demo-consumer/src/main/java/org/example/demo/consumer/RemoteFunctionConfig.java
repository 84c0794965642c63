package org.example.demo.consumer;

import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.core.config.RemoteCallOptions;
import org.example.remotefn.core.registry.FunctionCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 启动时把远程函数登记到函数目录里，地址和超时从 application.properties 读取
 */
@Configuration
public class RemoteFunctionConfig {

    @Value("${remote.function.host:localhost}")
    private String host;

    @Value("${remote.function.port:9999}")
    private int port;

    @Value("${remote.function.connect-timeout-millis:3000}")
    private int connectTimeoutMillis;

    @Value("${remote.function.request-timeout-millis:10000}")
    private long requestTimeoutMillis;

    @Bean
    public RemoteCallOptions remoteCallOptions() {
        return RemoteCallOptions.builder()
                .connectTimeoutMillis(connectTimeoutMillis)
                .requestTimeoutMillis(requestTimeoutMillis)
                .build();
    }

    @Bean
    public FunctionCatalog functionCatalog(RemoteCallOptions options) {
        return createCatalog(RemoteEndpoint.of(host, port), options);
    }

    /**
     * 和 demo-provider 里的函数库一一对应；这里只登记签名，不检查远端是否在线
     */
    public static FunctionCatalog createCatalog(RemoteEndpoint endpoint, RemoteCallOptions options) {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.registerRemoteFunction("remote_plus", List.of(
                signature(ColumnType.BIGINT, ColumnType.BIGINT, ColumnType.BIGINT),
                signature(ColumnType.INTEGER, ColumnType.INTEGER, ColumnType.INTEGER),
                signature(ColumnType.DOUBLE, ColumnType.DOUBLE, ColumnType.DOUBLE)), endpoint, options);
        catalog.registerRemoteFunction("remote_divide", List.of(
                signature(ColumnType.DOUBLE, ColumnType.DOUBLE, ColumnType.DOUBLE)), endpoint, options);
        catalog.registerRemoteFunction("remote_substr", List.of(
                signature(ColumnType.VARCHAR, ColumnType.VARCHAR, ColumnType.INTEGER),
                signature(ColumnType.VARCHAR, ColumnType.VARCHAR, ColumnType.INTEGER, ColumnType.INTEGER)), endpoint, options);
        return catalog;
    }

    private static FunctionSignature signature(ColumnType returnType, ColumnType... argumentTypes) {
        return FunctionSignature.builder()
                .returnType(returnType)
                .argumentTypes(List.of(argumentTypes))
                .build();
    }
}
