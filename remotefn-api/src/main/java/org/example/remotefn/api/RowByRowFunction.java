package org.example.remotefn.api;

import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;

/**
 * 把逐行的 {@link ScalarFunction} 包装成列式的 {@link VectorFunction}。
 * 默认任一参数为 null 时结果为 null，不调用函数体。
 */
public class RowByRowFunction implements VectorFunction {

    private final ScalarFunction body;
    private final boolean callOnNullInput;

    private RowByRowFunction(ScalarFunction body, boolean callOnNullInput) {
        this.body = body;
        this.callOnNullInput = callOnNullInput;
    }

    public static RowByRowFunction of(ScalarFunction body) {
        return new RowByRowFunction(body, false);
    }

    public static RowByRowFunction callingOnNullInput(ScalarFunction body) {
        return new RowByRowFunction(body, true);
    }

    @Override
    public ColumnVector apply(ColumnBatch arguments, ColumnType returnType) {
        int rows = arguments.getRowCount();
        int columns = arguments.getColumnCount();
        Object[] results = new Object[rows];
        Object[] row = new Object[columns];

        for (int i = 0; i < rows; i++) {
            boolean anyNull = false;
            for (int c = 0; c < columns; c++) {
                row[c] = arguments.vector(c).get(i);
                anyNull |= row[c] == null;
            }
            if (anyNull && !callOnNullInput) {
                continue;
            }
            results[i] = returnType.coerce(body.call(row.clone()));
        }
        return ColumnVector.of(returnType, results);
    }
}
