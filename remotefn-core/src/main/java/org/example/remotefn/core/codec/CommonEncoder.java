package org.example.remotefn.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.core.serializer.Serializer;

/**
 * 编码器：WireRequest / WireResponse -> 一个完整的帧
 * <pre>
 * magic(4) | 协议版本(1) | 序列化方式(1) | 消息类型(1) | 数据长度(4) | 数据
 * </pre>
 */
public class CommonEncoder extends MessageToByteEncoder<Object> {

    public static final int MAGIC_NUMBER = 0xCAFEBABE;
    public static final byte PROTOCOL_VERSION = 1;
    public static final byte REQUEST_TYPE = 0;
    public static final byte RESPONSE_TYPE = 1;

    private final Serializer serializer;

    public CommonEncoder(Serializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public boolean acceptOutboundMessage(Object msg) {
        return msg instanceof WireRequest || msg instanceof WireResponse;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) {
        byte[] bytes = serializer.serialize(msg);

        out.writeInt(MAGIC_NUMBER);
        out.writeByte(PROTOCOL_VERSION);
        out.writeByte(serializer.getCode());
        out.writeByte(msg instanceof WireRequest ? REQUEST_TYPE : RESPONSE_TYPE);
        // 数据长度放在数据前面，接收方据此拆包
        out.writeInt(bytes.length);
        out.writeBytes(bytes);
    }
}
