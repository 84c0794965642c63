package org.example.remotefn.common.vector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 一列数据：同一类型的若干个值，null 元素表示该行为空。
 * 对象创建后不可变，所有输入数组都会被复制。
 */
public final class ColumnVector {

    private final ColumnType type;
    private final Object[] values;

    private ColumnVector(ColumnType type, Object[] values) {
        this.type = Objects.requireNonNull(type, "type");
        for (int i = 0; i < values.length; i++) {
            if (!type.accepts(values[i])) {
                throw new IllegalArgumentException("Value at position " + i + " is a "
                        + values[i].getClass().getSimpleName() + ", expected " + type.getSqlName());
            }
            if (values[i] instanceof byte[]) {
                values[i] = ((byte[]) values[i]).clone();
            } else if (values[i] instanceof String && !isWellFormed((String) values[i])) {
                throw new IllegalArgumentException("Value at position " + i + " contains an unpaired surrogate");
            }
        }
        this.values = values;
    }

    // 孤立的代理字符无法编码成 UTF-8，这里提前拒绝
    private static boolean isWellFormed(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    public static ColumnVector of(ColumnType type, Object... values) {
        return new ColumnVector(type, values == null ? new Object[]{null} : values.clone());
    }

    public static ColumnVector of(ColumnType type, List<?> values) {
        return new ColumnVector(type, values.toArray());
    }

    public static ColumnVector empty(ColumnType type) {
        return new ColumnVector(type, new Object[0]);
    }

    public static ColumnVector nulls(ColumnType type, int size) {
        return new ColumnVector(type, new Object[size]);
    }

    public static ColumnVector ofLongs(long... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new ColumnVector(ColumnType.BIGINT, boxed);
    }

    public static ColumnVector ofInts(int... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new ColumnVector(ColumnType.INTEGER, boxed);
    }

    public static ColumnVector ofDoubles(double... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new ColumnVector(ColumnType.DOUBLE, boxed);
    }

    public static ColumnVector ofStrings(String... values) {
        return of(ColumnType.VARCHAR, (Object[]) values);
    }

    public ColumnType getType() {
        return type;
    }

    public int size() {
        return values.length;
    }

    public boolean isNull(int position) {
        return values[position] == null;
    }

    public boolean mayHaveNulls() {
        for (Object value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 按行取值，空行返回 null。VARBINARY 返回的是副本。
     */
    public Object get(int position) {
        Object value = values[position];
        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    public long getLong(int position) {
        return ((Number) requireValue(position)).longValue();
    }

    public int getInt(int position) {
        return ((Number) requireValue(position)).intValue();
    }

    public double getDouble(int position) {
        return ((Number) requireValue(position)).doubleValue();
    }

    public boolean getBoolean(int position) {
        return (Boolean) requireValue(position);
    }

    public String getString(int position) {
        return (String) values[position];
    }

    public List<Object> toList() {
        return Arrays.asList(values.clone());
    }

    private Object requireValue(int position) {
        Object value = values[position];
        if (value == null) {
            throw new IllegalStateException("Position " + position + " is null");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnVector)) {
            return false;
        }
        ColumnVector that = (ColumnVector) o;
        // Double/Float 的 equals 按位比较，byte[] 由 deepEquals 按内容比较
        return type == that.type && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.getSqlName()).append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Object value = values[i];
            if (value instanceof byte[]) {
                sb.append(Arrays.toString((byte[]) value));
            } else if (value instanceof String) {
                sb.append('"').append(value).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.append(']').toString();
    }
}
