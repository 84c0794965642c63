package org.example.remotefn.common.vector;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnVectorTest {

    @Test
    void tracksNullPositions() {
        ColumnVector vector = ColumnVector.of(ColumnType.BIGINT, 1L, null, 3L);

        assertThat(vector.size()).isEqualTo(3);
        assertThat(vector.isNull(1)).isTrue();
        assertThat(vector.mayHaveNulls()).isTrue();
        assertThat(ColumnVector.ofLongs(1, 2).mayHaveNulls()).isFalse();
    }

    @Test
    void rejectsValuesOfTheWrongClass() {
        assertThatThrownBy(() -> ColumnVector.of(ColumnType.BIGINT, 1L, "two"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void binaryValuesAreCopied() {
        byte[] bytes = {1, 2, 3};
        ColumnVector vector = ColumnVector.of(ColumnType.VARBINARY, (Object) bytes);

        bytes[0] = 9;
        ((byte[]) vector.get(0))[1] = 9;

        assertThat(vector).isEqualTo(ColumnVector.of(ColumnType.VARBINARY, (Object) new byte[]{1, 2, 3}));
    }

    @Test
    void equalityIncludesTheType() {
        assertThat(ColumnVector.ofInts(1, 2)).isNotEqualTo(ColumnVector.ofLongs(1, 2));
        assertThat(ColumnVector.empty(ColumnType.VARCHAR)).isEqualTo(ColumnVector.of(ColumnType.VARCHAR, List.of()));
        assertThat(ColumnVector.nulls(ColumnType.DOUBLE, 2)).isEqualTo(ColumnVector.of(ColumnType.DOUBLE, null, null));
    }

    @Test
    void batchRequiresEqualColumnLengths() {
        assertThatThrownBy(() -> ColumnBatch.of(ColumnVector.ofLongs(1, 2), ColumnVector.ofLongs(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'c1' has 1 rows");
    }

    @Test
    void coercesLooseValues() {
        assertThat(ColumnType.BIGINT.coerce(7)).isEqualTo(7L);
        assertThat(ColumnType.SMALLINT.coerce("12")).isEqualTo((short) 12);
        assertThat(ColumnType.DOUBLE.coerce(2)).isEqualTo(2.0);
        assertThat(ColumnType.VARCHAR.coerce(5)).isEqualTo("5");
        assertThat(ColumnType.BOOLEAN.coerce("true")).isEqualTo(true);
        assertThat(ColumnType.INTEGER.coerce(null)).isNull();
        assertThatThrownBy(() -> ColumnType.VARBINARY.coerce(1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsLossyNarrowing() {
        assertThatThrownBy(() -> ColumnType.INTEGER.coerce(3_000_000_000L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not fit integer");
        assertThatThrownBy(() -> ColumnType.BIGINT.coerce(1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnType.TINYINT.coerce(300))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnType.SMALLINT.coerce("1.25"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnType.BIGINT.coerce(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnType.REAL.coerce(1e300))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsExactNarrowing() {
        assertThat(ColumnType.INTEGER.coerce(2_000_000_000L)).isEqualTo(2_000_000_000);
        assertThat(ColumnType.BIGINT.coerce(4.0)).isEqualTo(4L);
        assertThat(ColumnType.TINYINT.coerce(-128)).isEqualTo((byte) -128);
        assertThat(ColumnType.BIGINT.coerce("9223372036854775807")).isEqualTo(Long.MAX_VALUE);
        assertThat(ColumnType.REAL.coerce(0.5)).isEqualTo(0.5f);
    }

    @Test
    void rejectsUnpairedSurrogates() {
        assertThatThrownBy(() -> ColumnVector.ofStrings("ok", "a\uD800b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position 1");
        assertThatThrownBy(() -> ColumnVector.ofStrings("\uDC00"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ColumnVector.ofStrings("a\uD83D\uDE00b").getString(0)).hasSize(4);
    }

    @Test
    void resolvesTypesByNameAndTag() {
        assertThat(ColumnType.fromSqlName(" VarChar ")).isEqualTo(ColumnType.VARCHAR);
        assertThat(ColumnType.fromTag(ColumnType.REAL.getTag())).isEqualTo(ColumnType.REAL);
        assertThat(ColumnType.fromTag((byte) 99)).isNull();
        assertThatThrownBy(() -> ColumnType.fromSqlName("decimal"))
                .hasMessage("Unknown column type: decimal");
    }
}
