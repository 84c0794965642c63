package org.example.remotefn.common.vector;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一批行数据，按列存放。
 * 约束：每一列的长度都等于 rowCount；列的顺序有意义。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ColumnBatch {

    private final int rowCount;
    private final List<Column> columns;

    public ColumnBatch(int rowCount, List<Column> columns) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must be >= 0, got " + rowCount);
        }
        Objects.requireNonNull(columns, "columns");
        for (Column column : columns) {
            if (column.getVector().size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                        + column.getVector().size() + " rows, batch declares " + rowCount);
            }
        }
        this.rowCount = rowCount;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * 按 c0, c1, ... 自动命名列，行数取第一列的长度
     */
    public static ColumnBatch of(ColumnVector... vectors) {
        if (vectors.length == 0) {
            return new ColumnBatch(0, List.of());
        }
        List<Column> columns = new ArrayList<>(vectors.length);
        for (int i = 0; i < vectors.length; i++) {
            columns.add(new Column("c" + i, vectors[i]));
        }
        return new ColumnBatch(vectors[0].size(), columns);
    }

    public static ColumnBatch empty(List<ColumnType> types) {
        List<Column> columns = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            columns.add(new Column("c" + i, ColumnVector.empty(types.get(i))));
        }
        return new ColumnBatch(0, columns);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public ColumnVector vector(int index) {
        return columns.get(index).getVector();
    }

    public List<ColumnType> columnTypes() {
        List<ColumnType> types = new ArrayList<>(columns.size());
        for (Column column : columns) {
            types.add(column.getVector().getType());
        }
        return types;
    }

    /**
     * 一个有名字的列
     */
    @Value
    public static class Column {
        String name;
        ColumnVector vector;

        public Column(String name, ColumnVector vector) {
            this.name = Objects.requireNonNull(name, "name");
            this.vector = Objects.requireNonNull(vector, "vector");
        }
    }
}
