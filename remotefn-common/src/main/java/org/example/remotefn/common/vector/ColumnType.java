package org.example.remotefn.common.vector;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.function.Function;

/**
 * 列的逻辑类型
 * 每个类型有一个固定的线上标签 (tag)，编码时写入字节流，解码时据此还原类型。
 * 标签一旦发布就不能改，否则新老两端无法互通。
 */
@AllArgsConstructor
@Getter
public enum ColumnType {

    BOOLEAN((byte) 1, "boolean", Boolean.class, 1),
    TINYINT((byte) 2, "tinyint", Byte.class, 1),
    SMALLINT((byte) 3, "smallint", Short.class, 2),
    INTEGER((byte) 4, "integer", Integer.class, 4),
    BIGINT((byte) 5, "bigint", Long.class, 8),
    REAL((byte) 6, "real", Float.class, 4),
    DOUBLE((byte) 7, "double", Double.class, 8),
    VARCHAR((byte) 8, "varchar", String.class, -1),
    VARBINARY((byte) 9, "varbinary", byte[].class, -1);

    private final byte tag;
    private final String sqlName;
    private final Class<?> javaType;

    /**
     * 定长类型的字节宽度，变长类型为 -1
     */
    private final int fixedWidth;

    public boolean isFixedWidth() {
        return fixedWidth > 0;
    }

    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    /**
     * 根据线上标签查找类型，未知标签返回 null，由调用方决定怎么报错
     */
    public static ColumnType fromTag(byte tag) {
        for (ColumnType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }

    public static ColumnType fromSqlName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column type name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.sqlName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type: " + name);
    }

    /**
     * 把宽松的 Java 值（比如 JSON 解析出来的 Integer/Double）转换成本类型要求的值。
     * 整数类型只接受能精确表示的值，越界或带小数都会报错，不会截断。
     */
    public Object coerce(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        switch (this) {
            case TINYINT:
                return exact(value, BigDecimal::byteValueExact);
            case SMALLINT:
                return exact(value, BigDecimal::shortValueExact);
            case INTEGER:
                return exact(value, BigDecimal::intValueExact);
            case BIGINT:
                return exact(value, BigDecimal::longValueExact);
            case REAL:
                return toFloat(value);
            case DOUBLE:
                return toDouble(value);
            case BOOLEAN:
                if (value instanceof String) {
                    return Boolean.parseBoolean((String) value);
                }
                break;
            case VARCHAR:
                return value.toString();
            default:
                break;
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName()
                + " value '" + value + "' to " + sqlName);
    }

    private <T> T exact(Object value, Function<BigDecimal, T> conversion) {
        BigDecimal decimal = asDecimal(value);
        try {
            return conversion.apply(decimal);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Value '" + value + "' does not fit " + sqlName, e);
        }
    }

    private Float toFloat(Object value) {
        double d = toDouble(value);
        float f = (float) d;
        if (Float.isInfinite(f) && !Double.isInfinite(d)) {
            throw new IllegalArgumentException("Value '" + value + "' does not fit " + sqlName);
        }
        return f;
    }

    private Double toDouble(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        return asDecimal(value).doubleValue();
    }

    private BigDecimal asDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Value '" + value + "' does not fit " + sqlName);
            }
            return new BigDecimal(d);
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getSimpleName()
                + " value '" + value + "' to " + sqlName);
    }
}
