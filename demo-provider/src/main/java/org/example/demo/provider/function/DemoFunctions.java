package org.example.demo.provider.function;

import org.example.remotefn.api.RowByRowFunction;
import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.core.registry.FunctionRegistry;

/**
 * 本进程提供的函数库，启动时一次性注册到分发表
 */
public final class DemoFunctions {

    public static final String PLUS = "remote_plus";
    public static final String DIVIDE = "remote_divide";
    public static final String SUBSTR = "remote_substr";

    private DemoFunctions() {
    }

    /**
     * @param prefix 服务端前缀，比如 "remote"，注册名为 prefix + "." + 函数名
     */
    public static FunctionRegistry.Builder registerAll(FunctionRegistry.Builder builder, String prefix) {
        RowByRowFunction plus = RowByRowFunction.of(new PlusFunction());
        builder.register(qualify(prefix, PLUS), signature(ColumnType.BIGINT, ColumnType.BIGINT, ColumnType.BIGINT), plus);
        builder.register(qualify(prefix, PLUS), signature(ColumnType.INTEGER, ColumnType.INTEGER, ColumnType.INTEGER), plus);
        builder.register(qualify(prefix, PLUS), signature(ColumnType.DOUBLE, ColumnType.DOUBLE, ColumnType.DOUBLE), plus);

        builder.register(qualify(prefix, DIVIDE), signature(ColumnType.DOUBLE, ColumnType.DOUBLE, ColumnType.DOUBLE),
                RowByRowFunction.of(new CheckedDivideFunction()));

        RowByRowFunction substr = RowByRowFunction.of(new SubstrFunction());
        builder.register(qualify(prefix, SUBSTR), signature(ColumnType.VARCHAR, ColumnType.VARCHAR, ColumnType.INTEGER), substr);
        builder.register(qualify(prefix, SUBSTR),
                signature(ColumnType.VARCHAR, ColumnType.VARCHAR, ColumnType.INTEGER, ColumnType.INTEGER), substr);
        return builder;
    }

    /**
     * 签名的写法：第一个是返回类型，后面依次是参数类型
     */
    public static FunctionSignature signature(ColumnType returnType, ColumnType... argumentTypes) {
        FunctionSignature.FunctionSignatureBuilder builder = FunctionSignature.builder().returnType(returnType);
        for (ColumnType argumentType : argumentTypes) {
            builder.argumentType(argumentType);
        }
        return builder.build();
    }

    private static String qualify(String prefix, String name) {
        return prefix == null || prefix.isEmpty() ? name : prefix + "." + name;
    }
}
