package org.example.remotefn.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.example.remotefn.common.exception.MalformedPayloadException;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 列式编解码：ColumnBatch <-> byte[]
 * <p>
 * 字节布局（大端）：
 * <pre>
 * magic(4) | version(1) | rowCount(4) | columnCount(4)
 * 每一列:
 *   nameLength(4) | name(UTF-8)
 *   typeTag(1) | hasNulls(1) | [null 位图 ceil(rowCount/8)]
 *   定长类型: rowCount 个槽位，空行写 0
 *   变长类型: rowCount 个长度(4)，空行长度为 0 | 所有值按顺序拼接
 * </pre>
 * 无状态，可以被多个线程同时使用。
 */
public final class ColumnBatchCodec {

    private static final int MAGIC_NUMBER = 0x52434F4C; // "RCOL"
    private static final byte FORMAT_VERSION = 1;

    private ColumnBatchCodec() {
    }

    public static byte[] encode(ColumnBatch batch) {
        ByteBuf out = Unpooled.buffer(estimateSize(batch));
        try {
            out.writeInt(MAGIC_NUMBER);
            out.writeByte(FORMAT_VERSION);
            out.writeInt(batch.getRowCount());
            out.writeInt(batch.getColumnCount());
            for (ColumnBatch.Column column : batch.getColumns()) {
                writeColumn(out, column, batch.getRowCount());
            }
            byte[] bytes = new byte[out.readableBytes()];
            out.readBytes(bytes);
            return bytes;
        } finally {
            out.release();
        }
    }

    public static ColumnBatch decode(byte[] bytes) {
        if (bytes == null) {
            throw new MalformedPayloadException("Payload is missing");
        }
        ByteBuf in = Unpooled.wrappedBuffer(bytes);
        try {
            require(in, 4 + 1 + 4 + 4, "header");
            int magic = in.readInt();
            if (magic != MAGIC_NUMBER) {
                throw new MalformedPayloadException("Unknown payload magic 0x" + Integer.toHexString(magic));
            }
            byte version = in.readByte();
            if (version != FORMAT_VERSION) {
                throw new MalformedPayloadException("Unsupported payload version " + version);
            }
            int rowCount = in.readInt();
            int columnCount = in.readInt();
            if (rowCount < 0 || columnCount < 0) {
                throw new MalformedPayloadException("Negative row count (" + rowCount
                        + ") or column count (" + columnCount + ")");
            }
            // 每一列每一行至少占 1 个字节，先用剩余长度挡住伪造的超大行数
            if (columnCount > 0 && rowCount > in.readableBytes()) {
                throw new MalformedPayloadException("Payload declares " + rowCount + " rows but only "
                        + in.readableBytes() + " bytes follow the header");
            }

            List<ColumnBatch.Column> columns = new ArrayList<>(Math.min(columnCount, 1024));
            for (int c = 0; c < columnCount; c++) {
                columns.add(readColumn(in, c, rowCount));
            }
            if (in.isReadable()) {
                throw new MalformedPayloadException(in.readableBytes() + " trailing bytes after "
                        + columnCount + " columns");
            }
            return new ColumnBatch(rowCount, columns);
        } finally {
            in.release();
        }
    }

    private static void writeColumn(ByteBuf out, ColumnBatch.Column column, int rowCount) {
        ColumnVector vector = column.getVector();
        ColumnType type = vector.getType();

        byte[] name = column.getName().getBytes(StandardCharsets.UTF_8);
        out.writeInt(name.length);
        out.writeBytes(name);
        out.writeByte(type.getTag());

        boolean hasNulls = vector.mayHaveNulls();
        out.writeByte(hasNulls ? 1 : 0);
        if (hasNulls) {
            byte[] bitmap = new byte[bitmapSize(rowCount)];
            for (int i = 0; i < rowCount; i++) {
                if (vector.isNull(i)) {
                    bitmap[i >>> 3] |= (byte) (1 << (i & 7));
                }
            }
            out.writeBytes(bitmap);
        }

        if (type.isFixedWidth()) {
            for (int i = 0; i < rowCount; i++) {
                writeFixed(out, type, vector.get(i));
            }
            return;
        }

        byte[][] values = new byte[rowCount][];
        for (int i = 0; i < rowCount; i++) {
            values[i] = variableBytes(type, vector.get(i));
            out.writeInt(values[i].length);
        }
        for (byte[] value : values) {
            out.writeBytes(value);
        }
    }

    private static ColumnBatch.Column readColumn(ByteBuf in, int index, int rowCount) {
        require(in, 4, "name length of column " + index);
        int nameLength = in.readInt();
        if (nameLength < 0) {
            throw new MalformedPayloadException("Negative name length for column " + index);
        }
        require(in, nameLength, "name of column " + index);
        String name = in.readCharSequence(nameLength, StandardCharsets.UTF_8).toString();

        require(in, 2, "type of column '" + name + "'");
        byte tag = in.readByte();
        ColumnType type = ColumnType.fromTag(tag);
        if (type == null) {
            throw new MalformedPayloadException("Unknown type tag " + tag + " for column '" + name + "'");
        }

        byte nullFlag = in.readByte();
        if (nullFlag != 0 && nullFlag != 1) {
            throw new MalformedPayloadException("Invalid null flag " + nullFlag + " for column '" + name + "'");
        }
        // 分配数组之前先确认剩余字节至少够位图加上每行的槽位或长度
        long minimum = (nullFlag == 1 ? bitmapSize(rowCount) : 0)
                + (long) rowCount * (type.isFixedWidth() ? type.getFixedWidth() : 4);
        require(in, minimum, "column '" + name + "'");

        boolean[] nulls = new boolean[rowCount];
        if (nullFlag == 1) {
            int size = bitmapSize(rowCount);
            for (int i = 0; i < size; i++) {
                byte bits = in.readByte();
                for (int bit = 0; bit < 8 && i * 8 + bit < rowCount; bit++) {
                    nulls[i * 8 + bit] = (bits & (1 << bit)) != 0;
                }
            }
        }

        Object[] values = new Object[rowCount];
        if (type.isFixedWidth()) {
            require(in, (long) rowCount * type.getFixedWidth(), "values of column '" + name + "'");
            for (int i = 0; i < rowCount; i++) {
                Object value = readFixed(in, type);
                values[i] = nulls[i] ? null : value;
            }
        } else {
            require(in, (long) rowCount * 4, "value lengths of column '" + name + "'");
            int[] lengths = new int[rowCount];
            long total = 0;
            for (int i = 0; i < rowCount; i++) {
                lengths[i] = in.readInt();
                if (lengths[i] < 0) {
                    throw new MalformedPayloadException("Negative value length at row " + i
                            + " of column '" + name + "'");
                }
                if (nulls[i] && lengths[i] != 0) {
                    throw new MalformedPayloadException("Null row " + i + " of column '" + name
                            + "' carries " + lengths[i] + " bytes");
                }
                total += lengths[i];
            }
            require(in, total, "values of column '" + name + "'");
            for (int i = 0; i < rowCount; i++) {
                byte[] value = new byte[lengths[i]];
                in.readBytes(value);
                if (!nulls[i]) {
                    values[i] = type == ColumnType.VARCHAR ? decodeUtf8(value, i, name) : value;
                }
            }
        }
        return new ColumnBatch.Column(name, ColumnVector.of(type, values));
    }

    private static void writeFixed(ByteBuf out, ColumnType type, Object value) {
        switch (type) {
            case BOOLEAN:
                out.writeByte(value != null && (Boolean) value ? 1 : 0);
                break;
            case TINYINT:
                out.writeByte(value == null ? 0 : (Byte) value);
                break;
            case SMALLINT:
                out.writeShort(value == null ? 0 : (Short) value);
                break;
            case INTEGER:
                out.writeInt(value == null ? 0 : (Integer) value);
                break;
            case BIGINT:
                out.writeLong(value == null ? 0L : (Long) value);
                break;
            case REAL:
                // 用 raw bits，保证 NaN 的具体位模式也能原样往返
                out.writeInt(value == null ? 0 : Float.floatToRawIntBits((Float) value));
                break;
            case DOUBLE:
                out.writeLong(value == null ? 0L : Double.doubleToRawLongBits((Double) value));
                break;
            default:
                throw new IllegalStateException("Not a fixed width type: " + type);
        }
    }

    private static Object readFixed(ByteBuf in, ColumnType type) {
        switch (type) {
            case BOOLEAN:
                return in.readByte() != 0;
            case TINYINT:
                return in.readByte();
            case SMALLINT:
                return in.readShort();
            case INTEGER:
                return in.readInt();
            case BIGINT:
                return in.readLong();
            case REAL:
                return Float.intBitsToFloat(in.readInt());
            case DOUBLE:
                return Double.longBitsToDouble(in.readLong());
            default:
                throw new IllegalStateException("Not a fixed width type: " + type);
        }
    }

    private static byte[] variableBytes(ColumnType type, Object value) {
        if (value == null) {
            return new byte[0];
        }
        if (type == ColumnType.VARCHAR) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        return (byte[]) value;
    }

    private static String decodeUtf8(byte[] value, int row, String column) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(value))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedPayloadException("Invalid UTF-8 at row " + row + " of column '" + column + "'", e);
        }
    }

    private static void require(ByteBuf in, long bytes, String what) {
        if (in.readableBytes() < bytes) {
            throw new MalformedPayloadException("Payload truncated while reading " + what + ": need "
                    + bytes + " bytes, " + in.readableBytes() + " left");
        }
    }

    private static int bitmapSize(int rowCount) {
        return (int) (((long) rowCount + 7) >>> 3);
    }

    private static int estimateSize(ColumnBatch batch) {
        int size = 13;
        for (ColumnBatch.Column column : batch.getColumns()) {
            int width = column.getVector().getType().isFixedWidth() ? column.getVector().getType().getFixedWidth() : 8;
            size += 16 + column.getName().length() + batch.getRowCount() * width;
        }
        return size;
    }
}
