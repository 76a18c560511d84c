/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

import java.math.BigInteger;
import java.time.Instant;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameTest {

    @Test
    void testToString() {
        Frame frame = new Frame("A", List.of(
                Field.of("time", FieldType.TIME, Map.of(), new Object[]{ Instant.EPOCH, Instant.EPOCH }),
                Field.of("v", FieldType.NULLABLE_FLOAT64, Map.of("host", "a"), new Object[]{ 1.5d, null })),
                2, new FrameMeta(FrameType.TIME_SERIES_WIDE, Visualization.GRAPH, "", List.of()));

        assertThat(frame.toString()).isEqualTo(
                "Frame[name=A, rows=2, type=TIME_SERIES_WIDE]\n" +
                        "| time                 | v {host=a}       |\n" +
                        "| TIME                 | NULLABLE_FLOAT64 |\n" +
                        "| 1970-01-01T00:00:00Z | 1.5              |\n" +
                        "| 1970-01-01T00:00:00Z | null             |\n");
    }

    @Test
    void testToStringTruncatesRows() {
        Object[] values = new Object[25];
        for (int i = 0; i < values.length; i++) {
            values[i] = (long) i;
        }
        Frame frame = new Frame("B", List.of(Field.of("n", FieldType.INT64, Map.of(), values)), 25, null);

        String text = frame.toString();
        assertThat(text).startsWith("Frame[name=B, rows=25, type=null]\n");
        assertThat(text).contains("| 19 ");
        assertThat(text).doesNotContain("| 20 ");
        assertThat(text).endsWith("... 5 more rows\n");
    }

    @Test
    void testFieldLookup() {
        Frame frame = new Frame("A", List.of(
                Field.of("a", FieldType.TEXT, Map.of(), new Object[]{ "x" }),
                Field.of("b", FieldType.BOOLEAN, Map.of(), new Object[]{ true })), 1, null);

        assertThat(frame.getField("b").getValue(0)).isEqualTo(true);
        assertThat(frame.getField(0).name()).isEqualTo("a");
        assertThat(frame.getFieldCount()).isEqualTo(2);
        assertThatThrownBy(() -> frame.getField("c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Field not found: c");
    }

    @Test
    void testRejectsFieldsOfWrongLength() {
        Field field = Field.of("a", FieldType.TEXT, Map.of(), new Object[]{ "x", "y" });

        assertThatThrownBy(() -> new Frame("A", List.of(field), 3, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'a' has 2 values, expected 3");
    }

    @Test
    void testWithMeta() {
        Frame frame = new Frame("A", List.of(), 0, null);
        FrameMeta meta = new FrameMeta(FrameType.TABLE, Visualization.TABLE, "SELECT 1", List.of());

        Frame withMeta = frame.withMeta(meta);
        assertThat(withMeta.getMeta()).isEqualTo(meta);
        assertThat(frame.getMeta()).isNull();
    }

    @Test
    void testFieldEquality() {
        Field a = Field.of("v", FieldType.NULLABLE_FLOAT64, Map.of("host", "a"), new Object[]{ 1.5d, null, Double.NaN });
        Field b = Field.of("v", FieldType.NULLABLE_FLOAT64, Map.of("host", "a"), new Object[]{ 1.5d, null, Double.NaN });
        Field otherLabel = Field.of("v", FieldType.NULLABLE_FLOAT64, Map.of("host", "b"), new Object[]{ 1.5d, null, Double.NaN });
        Field otherValue = Field.of("v", FieldType.NULLABLE_FLOAT64, Map.of("host", "a"), new Object[]{ 2.5d, null, Double.NaN });

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(otherLabel);
        assertThat(a).isNotEqualTo(otherValue);
        assertThat(a.toString()).isEqualTo("DoubleField[name=v, type=NULLABLE_FLOAT64, labels={host=a}, size=3]");
    }

    @Test
    void testMissingRowsTakePartInEquality() {
        BitSet missing = new BitSet();
        missing.set(1);
        Field present = new Field.TextField("s", FieldType.NULLABLE_TEXT, Map.of(), new String[]{ "a", null }, new BitSet(), new BitSet());
        Field absent = new Field.TextField("s", FieldType.NULLABLE_TEXT, Map.of(), new String[]{ "a", null }, new BitSet(), missing);

        assertThat(present).isNotEqualTo(absent);
        assertThat(absent.isMissing(1)).isTrue();
    }

    @Test
    void testFieldCopiesItsInput() {
        long[] values = { 1L, 2L };
        BitSet nulls = new BitSet();
        Field.LongField field = new Field.LongField("n", FieldType.NULLABLE_INT64, Map.of(), values, nulls, new BitSet());

        values[0] = 99L;
        nulls.set(1);
        field.values()[1] = 42L;
        field.nulls().set(0);

        assertThat(field.get(0)).isEqualTo(1L);
        assertThat(field.get(1)).isEqualTo(2L);
        assertThat(field.isNull(0)).isFalse();
        assertThat(field.isNull(1)).isFalse();
    }

    @Test
    void testUnsignedValuesAboveLongRange() {
        BigInteger max = new BigInteger("18446744073709551615");
        Frame frame = new Frame("U", List.of(
                Field.of("u", FieldType.UINT64, Map.of(), new Object[]{ max, 5L }),
                Field.of("s", FieldType.INT64, Map.of(), new Object[]{ -1L, 5L })), 2, null);

        assertThat(frame.getField("u").getValue(0)).isEqualTo(max);
        assertThat(frame.getField("u").getValue(1)).isEqualTo(5L);
        assertThat(frame.getField("s").getValue(0)).isEqualTo(-1L);
        assertThat(frame.toString()).contains("| 18446744073709551615 | -1    |");
    }
}
