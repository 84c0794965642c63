package org.example.remotefn.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.core.serializer.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 解码器：字节流 -> WireRequest / WireResponse，帧格式见 {@link CommonEncoder}
 * <p>
 * magic 不对说明对端不是自己人，直接断开；其余问题（版本、序列化方式、数据体）先把整帧读完，
 * 再抛出 MalformedPayloadException，由后面的 handler 决定怎么回复。
 */
public class CommonDecoder extends ReplayingDecoder<Void> {

    private static final Logger log = LoggerFactory.getLogger(CommonDecoder.class);

    public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024 * 1024;

    private final Serializer serializer;
    private final int maxFrameLength;

    public CommonDecoder(Serializer serializer) {
        this(serializer, DEFAULT_MAX_FRAME_LENGTH);
    }

    public CommonDecoder(Serializer serializer, int maxFrameLength) {
        this.serializer = serializer;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        // 1. 校验魔数
        int magic = in.readInt();
        if (magic != CommonEncoder.MAGIC_NUMBER) {
            log.warn("不识别的协议包 (magic=0x{})，断开连接: {}", Integer.toHexString(magic), ctx.channel().remoteAddress());
            in.skipBytes(actualReadableBytes());
            ctx.close();
            return;
        }

        // 2. 协议头其余部分
        byte version = in.readByte();
        byte serializerCode = in.readByte();
        byte packageType = in.readByte();
        int length = in.readInt();
        if (length < 0 || length > maxFrameLength) {
            throw new TooLongFrameException("Frame length " + length + " exceeds limit " + maxFrameLength);
        }

        // 3. 读取数据本体
        byte[] bytes = new byte[length];
        in.readBytes(bytes);
        checkpoint();

        if (version != CommonEncoder.PROTOCOL_VERSION) {
            throw new MalformedPayloadException("Unsupported protocol version " + version
                    + ", expected " + CommonEncoder.PROTOCOL_VERSION);
        }
        if (serializerCode != serializer.getCode()) {
            throw new MalformedPayloadException("Unsupported serializer " + serializerCode);
        }

        // 4. 反序列化
        if (packageType == CommonEncoder.REQUEST_TYPE) {
            out.add(serializer.deserialize(bytes, WireRequest.class));
        } else if (packageType == CommonEncoder.RESPONSE_TYPE) {
            out.add(serializer.deserialize(bytes, WireResponse.class));
        } else {
            throw new MalformedPayloadException("Unknown message type " + packageType);
        }
    }
}
