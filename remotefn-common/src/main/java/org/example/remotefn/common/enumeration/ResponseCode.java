package org.example.remotefn.common.enumeration;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 统一远程调用结果的状态码。
 * 整个调用只有一个状态，没有逐行的成功/失败。
 */
@AllArgsConstructor
@Getter
public enum ResponseCode {

    SUCCESS(200, "调用函数成功"),
    MALFORMED_PAYLOAD(400, "请求数据无法解码"),
    FUNCTION_NOT_FOUND(404, "未找到指定函数"),
    EXECUTION_ERROR(500, "函数执行失败");

    private final int code;
    private final String message;

    public static ResponseCode fromCode(int code) {
        for (ResponseCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }
}
