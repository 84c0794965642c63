package org.example.remotefn.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.example.remotefn.common.entity.ColumnPage;
import org.example.remotefn.common.entity.WireRequest;
import org.example.remotefn.common.entity.WireResponse;
import org.example.remotefn.common.enumeration.ResponseCode;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.serializer.JsonSerializer;
import org.example.remotefn.core.serializer.Serializer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommonDecoderTest {

    private final Serializer serializer = new JsonSerializer();

    @Test
    void decodesRequestWrittenByEncoder() {
        ColumnBatch batch = ColumnBatch.of(ColumnVector.ofLongs(1, 2, 3));
        WireRequest request = WireRequest.builder()
                .requestId(7)
                .functionName("plus")
                .argumentTypes(List.of(ColumnType.BIGINT))
                .returnType(ColumnType.BIGINT)
                .inputs(ColumnPage.columnar(3, ColumnBatchCodec.encode(batch)))
                .throwOnError(true)
                .build();

        WireRequest decoded = (WireRequest) roundTrip(request);

        assertThat(decoded.getRequestId()).isEqualTo(7);
        assertThat(decoded.getFunctionName()).isEqualTo("plus");
        assertThat(decoded.getArgumentTypes()).containsExactly(ColumnType.BIGINT);
        assertThat(decoded.isThrowOnError()).isTrue();
        assertThat(ColumnBatchCodec.decode(decoded.getInputs().getPayload())).isEqualTo(batch);
    }

    @Test
    void decodesFailedResponse() {
        WireResponse response = WireResponse.fail(3, ResponseCode.FUNCTION_NOT_FOUND, "Function not found: remote.nope");

        WireResponse decoded = (WireResponse) roundTrip(response);

        assertThat(decoded.isSuccess()).isFalse();
        assertThat(decoded.getCode()).isEqualTo(404);
        assertThat(decoded.getErrors()).hasSize(1);
        assertThat(decoded.getErrors().get(0).getRow()).isNull();
        assertThat(decoded.getErrorMessage()).isEqualTo("Function not found: remote.nope");
    }

    @Test
    void waitsForTheWholeFrame() {
        ByteBuf frame = encode(WireResponse.fail(1, ResponseCode.EXECUTION_ERROR, "boom"));
        EmbeddedChannel channel = new EmbeddedChannel(new CommonDecoder(serializer));

        channel.writeInbound(frame.readRetainedSlice(9));
        assertThat((Object) channel.readInbound()).isNull();

        channel.writeInbound(frame);
        WireResponse decoded = channel.readInbound();
        assertThat(decoded.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void rejectsUnsupportedProtocolVersion() {
        ByteBuf frame = encode(WireResponse.fail(1, ResponseCode.EXECUTION_ERROR, "boom"));
        frame.setByte(4, 9);
        EmbeddedChannel channel = new EmbeddedChannel(new CommonDecoder(serializer));

        assertThatThrownBy(() -> channel.writeInbound(frame))
                .isInstanceOf(DecoderException.class)
                .hasCauseInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("protocol version 9");
    }

    @Test
    void rejectsUndecodableBody() {
        byte[] body = "{not json".getBytes(StandardCharsets.UTF_8);
        ByteBuf frame = Unpooled.buffer();
        frame.writeInt(CommonEncoder.MAGIC_NUMBER);
        frame.writeByte(CommonEncoder.PROTOCOL_VERSION);
        frame.writeByte(Serializer.JSON);
        frame.writeByte(CommonEncoder.REQUEST_TYPE);
        frame.writeInt(body.length);
        frame.writeBytes(body);
        EmbeddedChannel channel = new EmbeddedChannel(new CommonDecoder(serializer));

        assertThatThrownBy(() -> channel.writeInbound(frame))
                .isInstanceOf(DecoderException.class)
                .hasCauseInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void closesConnectionOnUnknownMagic() {
        ByteBuf garbage = Unpooled.buffer();
        garbage.writeInt(0x12345678);
        garbage.writeBytes(new byte[16]);
        EmbeddedChannel channel = new EmbeddedChannel(new CommonDecoder(serializer));

        channel.writeInbound(garbage);

        assertThat((Object) channel.readInbound()).isNull();
        assertThat(channel.isOpen()).isFalse();
    }

    private Object roundTrip(Object message) {
        EmbeddedChannel channel = new EmbeddedChannel(new CommonDecoder(serializer));
        channel.writeInbound(encode(message));
        return channel.readInbound();
    }

    private ByteBuf encode(Object message) {
        EmbeddedChannel channel = new EmbeddedChannel(new CommonEncoder(serializer));
        channel.writeOutbound(message);
        return channel.readOutbound();
    }
}
