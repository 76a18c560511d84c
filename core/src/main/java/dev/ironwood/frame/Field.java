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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named, typed column of a {@link Frame}.
 * <p>
 * Values are held in a primitive or object array with one entry per row. Rows holding a null
 * are flagged in {@link #nulls()}, rows lacking the field altogether in {@link #missing()};
 * the array entry of such rows is the type's default value.
 * </p>
 * <p>
 * Fields are immutable: arrays and bit sets are copied when a field is created and when they are
 * handed out by the accessors. Two fields are equal when name, type, labels, values and flags are.
 * </p>
 */
public sealed interface Field {

    String name();

    FieldType type();

    /** Labels qualifying the field, e.g. the factor values of a pivoted time series. */
    Map<String, String> labels();

    BitSet nulls();

    BitSet missing();

    int size();

    /**
     * Returns the boxed value of the given row, null if the row holds a null or lacks the field.
     */
    Object getValue(int row);

    default boolean isNull(int row) {
        return nulls().get(row);
    }

    default boolean isMissing(int row) {
        return missing().get(row);
    }

    default boolean isAbsent(int row) {
        return isNull(row) || isMissing(row);
    }

    /**
     * Creates a field of the given type from boxed values; null entries become null rows.
     */
    static Field of(String name, FieldType type, Map<String, String> labels, Object[] values) {
        int size = values.length;
        BitSet nulls = new BitSet(size);
        for (int i = 0; i < size; i++) {
            if (values[i] == null) {
                nulls.set(i);
            }
        }
        BitSet missing = new BitSet(size);

        switch (type.base()) {
            case BOOLEAN: {
                boolean[] array = new boolean[size];
                for (int i = 0; i < size; i++) {
                    array[i] = values[i] != null && (Boolean) values[i];
                }
                return new BooleanField(name, type, labels, array, nulls, missing);
            }
            case INT64:
            case UINT64: {
                long[] array = new long[size];
                for (int i = 0; i < size; i++) {
                    array[i] = values[i] != null ? ((Number) values[i]).longValue() : 0L;
                }
                return new LongField(name, type, labels, array, nulls, missing);
            }
            case FLOAT64: {
                double[] array = new double[size];
                for (int i = 0; i < size; i++) {
                    array[i] = values[i] != null ? ((Number) values[i]).doubleValue() : 0.0d;
                }
                return new DoubleField(name, type, labels, array, nulls, missing);
            }
            case TEXT: {
                String[] array = new String[size];
                for (int i = 0; i < size; i++) {
                    array[i] = (String) values[i];
                }
                return new TextField(name, type, labels, array, nulls, missing);
            }
            case TIME: {
                Instant[] array = new Instant[size];
                for (int i = 0; i < size; i++) {
                    array[i] = (Instant) values[i];
                }
                return new TimeField(name, type, labels, array, nulls, missing);
            }
            case JSON: {
                JsonNode[] array = new JsonNode[size];
                for (int i = 0; i < size; i++) {
                    array[i] = (JsonNode) values[i];
                }
                return new JsonField(name, type, labels, array, nulls, missing);
            }
            default:
                throw new IllegalArgumentException("Unsupported field type: " + type);
        }
    }

    private static Map<String, String> copyLabels(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    private static BitSet copyOf(BitSet bits) {
        return bits == null ? new BitSet() : (BitSet) bits.clone();
    }

    private static boolean sameHeader(Field a, Field b, BitSet nullsA, BitSet missingA) {
        return a.name().equals(b.name())
                && a.type() == b.type()
                && a.labels().equals(b.labels())
                && nullsA.equals(b.nulls())
                && missingA.equals(b.missing());
    }

    private static int headerHash(Field field, BitSet nulls, BitSet missing) {
        return Objects.hash(field.name(), field.type(), field.labels(), nulls, missing);
    }

    private static String describe(Field field) {
        return field.getClass().getSimpleName() + "[name=" + field.name() + ", type=" + field.type()
                + ", labels=" + field.labels() + ", size=" + field.size() + "]";
    }

    record BooleanField(String name, FieldType type, Map<String, String> labels, boolean[] values, BitSet nulls, BitSet missing)
            implements Field {

        public BooleanField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public boolean get(int row) {
            return values[row];
        }

        @Override
        public boolean[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            return isAbsent(row) ? null : values[row];
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }

    /**
     * Signed or unsigned 64-bit integers; {@link FieldType#UINT64} values above
     * {@link Long#MAX_VALUE} are stored as their two's complement bit pattern and boxed as
     * {@link BigInteger} by {@link #getValue(int)}.
     */
    record LongField(String name, FieldType type, Map<String, String> labels, long[] values, BitSet nulls, BitSet missing)
            implements Field {

        public LongField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public long get(int row) {
            return values[row];
        }

        public boolean isUnsigned() {
            return type.base() == FieldType.UINT64;
        }

        @Override
        public long[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            if (isAbsent(row)) {
                return null;
            }
            long value = values[row];
            if (value < 0 && isUnsigned()) {
                return new BigInteger(Long.toUnsignedString(value));
            }
            return value;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LongField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }

    record DoubleField(String name, FieldType type, Map<String, String> labels, double[] values, BitSet nulls, BitSet missing)
            implements Field {

        public DoubleField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public double get(int row) {
            return values[row];
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            return isAbsent(row) ? null : values[row];
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DoubleField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }

    record TextField(String name, FieldType type, Map<String, String> labels, String[] values, BitSet nulls, BitSet missing)
            implements Field {

        public TextField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public String get(int row) {
            return values[row];
        }

        @Override
        public String[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            return isAbsent(row) ? null : values[row];
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }

    record TimeField(String name, FieldType type, Map<String, String> labels, Instant[] values, BitSet nulls, BitSet missing)
            implements Field {

        public TimeField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public Instant get(int row) {
            return values[row];
        }

        @Override
        public Instant[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            return isAbsent(row) ? null : values[row];
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TimeField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }

    /**
     * Values of conflicting, nested or otherwise unmapped types, as JSON trees.
     */
    record JsonField(String name, FieldType type, Map<String, String> labels, JsonNode[] values, BitSet nulls, BitSet missing)
            implements Field {

        public JsonField {
            labels = copyLabels(labels);
            values = values.clone();
            nulls = copyOf(nulls);
            missing = copyOf(missing);
        }

        public JsonNode get(int row) {
            return values[row];
        }

        @Override
        public JsonNode[] values() {
            return values.clone();
        }

        @Override
        public BitSet nulls() {
            return copyOf(nulls);
        }

        @Override
        public BitSet missing() {
            return copyOf(missing);
        }

        @Override
        public boolean isNull(int row) {
            return nulls.get(row);
        }

        @Override
        public boolean isMissing(int row) {
            return missing.get(row);
        }

        @Override
        public Object getValue(int row) {
            return isAbsent(row) ? null : values[row];
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof JsonField other && sameHeader(this, other, nulls, missing)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return 31 * headerHash(this, nulls, missing) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return describe(this);
        }
    }
}
