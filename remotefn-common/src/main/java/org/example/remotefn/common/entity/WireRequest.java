package org.example.remotefn.common.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.remotefn.common.vector.ColumnType;

import java.io.Serializable;
import java.util.List;

/**
 * 远程函数调用的请求包
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class WireRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * 请求编号，服务端原样带回，客户端用来核对响应
     */
    private long requestId;

    /**
     * 服务端注册实现时用的名字（不带服务端前缀），不一定等于引擎里的别名
     */
    private String functionName;

    /**
     * 调用方认为的签名，服务端按解码出来的实际列类型查找实现
     */
    private List<ColumnType> argumentTypes;

    private ColumnType returnType;

    /**
     * 参数列
     */
    private ColumnPage inputs;

    /**
     * 这一版只传递不处理：整个调用只会整体成功或整体失败
     */
    private boolean throwOnError;
}
