package org.example.remotefn.core.transport;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.AttributeKey;
import org.example.remotefn.common.entity.WireResponse;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * 客户端处理器
 * 负责读取服务端返回的 WireResponse，和 RpcServerHandler 是对应的。
 * 结果通过绑定在 Channel 上的 CompletableFuture 交给等待中的调用线程。
 */
public class RpcClientHandler extends SimpleChannelInboundHandler<WireResponse> {

    static final AttributeKey<CompletableFuture<WireResponse>> RESPONSE_FUTURE = AttributeKey.valueOf("responseFuture");

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WireResponse msg) {
        CompletableFuture<WireResponse> future = ctx.channel().attr(RESPONSE_FUTURE).get();
        if (future != null) {
            future.complete(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        // 响应到达之前连接就断了，当作连接被重置
        CompletableFuture<WireResponse> future = ctx.channel().attr(RESPONSE_FUTURE).get();
        if (future != null) {
            future.completeExceptionally(new IOException("Connection reset: " + ctx.channel().remoteAddress()
                    + " closed the connection before responding"));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        CompletableFuture<WireResponse> future = ctx.channel().attr(RESPONSE_FUTURE).get();
        if (future != null) {
            future.completeExceptionally(cause);
        }
        ctx.close();
    }
}
