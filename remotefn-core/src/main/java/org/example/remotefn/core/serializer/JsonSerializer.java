package org.example.remotefn.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.remotefn.common.exception.MalformedPayloadException;

import java.io.IOException;

/**
 * 基于 Jackson 的信封序列化。byte[] 字段（列数据）按 Jackson 默认方式写成 base64。
 */
public class JsonSerializer implements Serializer {

    // ObjectMapper 配置好之后是线程安全的，全局共用一个
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public byte[] serialize(Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + obj.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] bytes, Class<T> clazz) {
        try {
            return OBJECT_MAPPER.readValue(bytes, clazz);
        } catch (IOException e) {
            throw new MalformedPayloadException("Cannot decode " + clazz.getSimpleName() + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public byte getCode() {
        return JSON;
    }
}
