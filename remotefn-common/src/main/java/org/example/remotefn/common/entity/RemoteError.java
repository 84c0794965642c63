package org.example.remotefn.common.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 响应里的一条错误。
 * row 为 null 表示整个调用失败；以后支持逐行出错时填具体行号，线上格式不需要变。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RemoteError implements Serializable {
    private static final long serialVersionUID = 1L;

    private Integer row;

    private String message;

    public static RemoteError forCall(String message) {
        return new RemoteError(null, message);
    }
}
