package org.example.remotefn.core.serializer;

/**
 * 请求/响应信封的序列化接口（目前只有 JSON，列数据本身由 ColumnBatchCodec 负责）
 * 目的：换序列化方式时不用改动传输层代码
 */
public interface Serializer {

    /**
     * JSON 序列化器在协议头里的编号
     */
    byte JSON = 1;

    /**
     * 序列化：Java对象 -> 字节数组
     */
    byte[] serialize(Object obj);

    /**
     * 反序列化：字节数组 -> Java对象，字节无法解析时抛出 MalformedPayloadException
     */
    <T> T deserialize(byte[] bytes, Class<T> clazz);

    /**
     * 写在协议头里的序列化方式编号
     */
    byte getCode();
}
