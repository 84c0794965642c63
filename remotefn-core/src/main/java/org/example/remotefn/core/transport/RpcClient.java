package org.example.remotefn.core.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.common.exception.ProtocolViolationException;
import org.example.remotefn.common.exception.RemoteConnectionException;
import org.example.remotefn.core.codec.CommonDecoder;
import org.example.remotefn.core.codec.CommonEncoder;
import org.example.remotefn.core.config.RemoteCallOptions;
import org.example.remotefn.core.serializer.JsonSerializer;
import org.example.remotefn.core.serializer.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Netty 客户端
 * 每次调用新建一条连接：连接 -> 发送 WireRequest -> 阻塞等待 WireResponse -> 关闭连接。
 * 除了目标地址之外不保存任何连接状态。
 */
public class RpcClient {

    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

    // 这里的序列化器需要和 Server 端保持一致
    private static final Serializer serializer = new JsonSerializer();

    private final RemoteEndpoint endpoint;
    private final RemoteCallOptions options;

    public RpcClient(RemoteEndpoint endpoint) {
        this(endpoint, RemoteCallOptions.DEFAULT);
    }

    public RpcClient(RemoteEndpoint endpoint, RemoteCallOptions options) {
        this.endpoint = endpoint;
        this.options = options;
    }

    public RemoteEndpoint getEndpoint() {
        return endpoint;
    }

    /**
     * 发送请求并等待响应
     *
     * @throws RemoteConnectionException   连不上、连接被重置或者等待超时
     * @throws ProtocolViolationException 收到的响应帧无法解码
     */
    public WireResponse sendRequest(WireRequest request) {
        EventLoopGroup group = new NioEventLoopGroup(1);
        Channel channel = null;
        try {
            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, options.getConnectTimeoutMillis())
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            // 流水线：Client 和 Server 是相反的
                            ch.pipeline().addLast(new CommonEncoder(serializer));
                            ch.pipeline().addLast(new CommonDecoder(serializer));
                            ch.pipeline().addLast(new RpcClientHandler());
                        }
                    });

            // 1. 连接服务端
            ChannelFuture connectFuture = bootstrap.connect(endpoint.getHost(), endpoint.getPort()).await();
            if (!connectFuture.isSuccess()) {
                Throwable cause = connectFuture.cause();
                throw new RemoteConnectionException(endpoint, describe(cause),
                        cause instanceof ConnectTimeoutException, cause);
            }
            channel = connectFuture.channel();

            // 2. 绑定响应等待机制，再发送请求
            CompletableFuture<WireResponse> responseFuture = new CompletableFuture<>();
            channel.attr(RpcClientHandler.RESPONSE_FUTURE).set(responseFuture);
            ChannelFuture writeFuture = channel.writeAndFlush(request).await();
            if (!writeFuture.isSuccess()) {
                throw new RemoteConnectionException(endpoint, describe(writeFuture.cause()), writeFuture.cause());
            }

            // 3. 等待响应
            WireResponse response = responseFuture.get(options.getRequestTimeoutMillis(), TimeUnit.MILLISECONDS);
            log.debug("收到 {} 的响应: requestId={}, code={}", endpoint, response.getRequestId(), response.getCode());
            return response;

        } catch (TimeoutException e) {
            throw RemoteConnectionException.timedOut(endpoint, options.getRequestTimeoutMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
            if (cause instanceof DecoderException || root instanceof MalformedPayloadException) {
                throw new ProtocolViolationException("Cannot decode response from " + endpoint + ": "
                        + root.getMessage(), root);
            }
            throw new RemoteConnectionException(endpoint, describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteConnectionException(endpoint, "interrupted while waiting for response", e);
        } finally {
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown transport failure";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
