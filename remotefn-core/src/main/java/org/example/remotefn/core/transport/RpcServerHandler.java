package org.example.remotefn.core.transport;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.enumeration.ResponseCode;
import org.example.remotefn.core.service.RemoteFunctionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 业务处理器
 * 作用：把解码后的 WireRequest 交给 RemoteFunctionService，写回 WireResponse
 */
public class RpcServerHandler extends SimpleChannelInboundHandler<WireRequest> {

    private static final Logger log = LoggerFactory.getLogger(RpcServerHandler.class);

    private final RemoteFunctionService service;

    public RpcServerHandler(RemoteFunctionService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WireRequest msg) {
        WireResponse response;
        try {
            response = service.invoke(msg);
        } catch (RuntimeException e) {
            // service 本身不应该抛异常，这里兜底，保证对端一定能收到响应
            log.error("处理请求 {} 时出现未预期的异常", msg.getRequestId(), e);
            response = WireResponse.fail(msg.getRequestId(), ResponseCode.EXECUTION_ERROR, String.valueOf(e.getMessage()));
        }
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (cause instanceof DecoderException) {
            // 帧解不开：回一个 MALFORMED_PAYLOAD，然后断开，这条连接上的字节流已经不可信了
            log.warn("收到无法解码的请求 {}: {}", ctx.channel().remoteAddress(), root.getMessage());
            ctx.writeAndFlush(WireResponse.fail(0, ResponseCode.MALFORMED_PAYLOAD, String.valueOf(root.getMessage())))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }
        log.warn("连接 {} 出现异常，关闭连接: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
