package org.example.remotefn.common.entity;

import lombok.NonNull;
import lombok.Value;

/**
 * 引擎目录里的一条远程函数登记：别名 + 签名 + 远端地址。
 * 启动时创建，之后不再修改；登记时不检查远端是否可达，第一次调用时才会发现。
 */
@Value
public class RegisteredRemoteFunction {

    @NonNull
    String name;

    @NonNull
    FunctionSignature signature;

    @NonNull
    RemoteEndpoint endpoint;
}
