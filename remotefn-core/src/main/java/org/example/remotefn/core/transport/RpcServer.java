package org.example.remotefn.core.transport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.example.remotefn.core.codec.CommonDecoder;
import org.example.remotefn.core.codec.CommonEncoder;
import org.example.remotefn.core.serializer.JsonSerializer;
import org.example.remotefn.core.serializer.Serializer;
import org.example.remotefn.core.service.RemoteFunctionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 远程函数服务端，基于 Netty
 * <p>
 * Boss 线程负责接收连接，Worker 线程负责编解码，函数计算放在单独的线程组里，避免阻塞 IO 线程。
 * 端口传 0 时由操作系统分配，启动后通过 {@link #getPort()} 取得实际端口。
 */
public class RpcServer {

    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 10_000;

    private final String host;
    private final int port;
    private final RemoteFunctionService service;
    private final Serializer serializer;
    private final int executorThreads;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup executorGroup;
    private Channel serverChannel;
    private volatile boolean serving;
    private volatile int boundPort = -1;

    public RpcServer(String host, int port, RemoteFunctionService service) {
        this(host, port, service, Runtime.getRuntime().availableProcessors() * 2);
    }

    public RpcServer(String host, int port, RemoteFunctionService service, int executorThreads) {
        this.host = host;
        this.port = port;
        this.service = service;
        this.serializer = new JsonSerializer();
        this.executorThreads = executorThreads;
    }

    /**
     * 绑定端口并开始服务，绑定成功后返回
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("RPC Server already started on port " + boundPort);
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        executorGroup = new DefaultEventExecutorGroup(executorThreads);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // 出站：编码器；入站：解码器 -> 处理器（在计算线程组上执行）
                        ch.pipeline().addLast(new CommonEncoder(serializer));
                        ch.pipeline().addLast(new CommonDecoder(serializer));
                        ch.pipeline().addLast(executorGroup, new RpcServerHandler(service));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        try {
            serverChannel = bootstrap.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            releaseGroups();
            throw e;
        } catch (Exception e) {
            // bind 失败（端口被占用等）
            releaseGroups();
            throw new IllegalStateException("Cannot bind RPC Server to " + host + ":" + port, e);
        }
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        serving = true;
        log.info("RPC Server 启动成功，监听端口: {}", boundPort);
    }

    public boolean isServing() {
        return serving;
    }

    /**
     * 实际监听的端口，未启动时为 -1
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * 优雅关闭：先停止接收新连接，再等正在计算的调用完成并写回，最后释放端口和线程
     */
    public synchronized void shutdown() {
        if (serverChannel == null) {
            return;
        }
        serving = false;
        serverChannel.close().syncUninterruptibly();
        releaseGroups();
        serverChannel = null;
        log.info("RPC Server 已关闭，端口: {}", boundPort);
    }

    /**
     * 阻塞直到服务端被关闭，用于进程的 main 方法
     */
    public void blockUntilShutdown() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    private void releaseGroups() {
        if (executorGroup != null) {
            executorGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        // 留一点安静期，让计算线程提交的写回任务在 IO 线程上执行完
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(100, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        executorGroup = null;
        workerGroup = null;
        bossGroup = null;
    }
}
