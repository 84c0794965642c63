package org.example.remotefn.common.entity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.example.remotefn.common.vector.ColumnType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 函数签名：有序的参数类型 + 一个返回类型，用来区分同名函数的不同重载。
 * <pre>
 * FunctionSignature.builder()
 *         .returnType(ColumnType.BIGINT)
 *         .argumentType(ColumnType.BIGINT)
 *         .argumentType(ColumnType.BIGINT)
 *         .build();
 * </pre>
 */
@Value
@Builder
public class FunctionSignature {

    @Singular
    List<ColumnType> argumentTypes;

    @NonNull
    ColumnType returnType;

    public boolean matches(List<ColumnType> actualArgumentTypes) {
        return argumentTypes.equals(actualArgumentTypes);
    }

    @Override
    public String toString() {
        return argumentTypes.stream()
                .map(ColumnType::getSqlName)
                .collect(Collectors.joining(", ", "(", ")")) + " -> " + returnType.getSqlName();
    }
}
