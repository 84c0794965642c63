package org.example.remotefn.api;

import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;

/**
 * 函数调用契约：输入一批参数列，输出一列结果。
 * 本地函数和远程函数（适配器）都实现这个接口，引擎不用区分两者。
 */
@FunctionalInterface
public interface VectorFunction {

    /**
     * @param arguments  参数列，顺序和类型与函数签名的参数一致
     * @param returnType 签名声明的返回类型
     * @return 和 arguments 行数相同的结果列
     */
    ColumnVector apply(ColumnBatch arguments, ColumnType returnType);
}
