package org.example.remotefn.api;

/**
 * 逐行计算的函数体，参数按签名顺序传入，都不为 null（除非声明了要处理 null）
 */
@FunctionalInterface
public interface ScalarFunction {

    Object call(Object[] arguments);
}
