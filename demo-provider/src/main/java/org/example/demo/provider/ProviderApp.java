package org.example.demo.provider;

import org.example.demo.provider.function.DemoFunctions;
import org.example.remotefn.core.registry.FunctionRegistry;
import org.example.remotefn.core.service.RemoteFunctionService;
import org.example.remotefn.core.transport.RpcServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 远程函数服务进程
 * 用法：ProviderApp [port] [host]，默认 9999 / 0.0.0.0，port 为 0 时由系统分配
 */
public class ProviderApp {

    private static final Logger log = LoggerFactory.getLogger(ProviderApp.class);

    public static final String FUNCTION_PREFIX = "remote";

    public static void main(String[] args) throws Exception {
        // 1. 确定监听地址
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 9999;
        String host = args.length > 1 ? args[1] : "0.0.0.0";

        // 2. 启动 RPC 服务
        RpcServer server = createServer(host, port);
        server.start();

        // 3. 进程退出时优雅关闭，等正在执行的调用完成
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "rpc-server-shutdown"));
        log.info("函数服务已就绪: {}:{}", host, server.getPort());

        server.blockUntilShutdown();
    }

    public static RpcServer createServer(String host, int port) {
        FunctionRegistry registry = DemoFunctions.registerAll(FunctionRegistry.builder(), FUNCTION_PREFIX).build();
        return new RpcServer(host, port, new RemoteFunctionService(registry, FUNCTION_PREFIX));
    }
}
