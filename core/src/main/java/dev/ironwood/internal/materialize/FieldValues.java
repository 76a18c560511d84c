/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.materialize;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.BitSet;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ironwood.frame.Field;
import dev.ironwood.frame.FieldType;
import dev.ironwood.internal.ion.IonBinaryReader;
import dev.ironwood.internal.ion.IonType;
import dev.ironwood.internal.ion.IonValueProjector;
import dev.ironwood.reader.FieldConversionException;

/**
 * Typed value array of one column under construction, bound to the decode function of its
 * target representation.
 * <p>
 * All rows start out missing. {@link #decode(IonBinaryReader, int)} is called once for every row
 * holding the field; nulls are recorded for nullable targets and rejected by the typed read
 * otherwise.
 * </p>
 */
public abstract sealed class FieldValues {

    protected final String name;
    protected final FieldType type;
    protected final BitSet nulls;
    protected final BitSet missing;

    FieldValues(String name, FieldType type, int rowCount) {
        this.name = name;
        this.type = type;
        this.nulls = new BitSet(rowCount);
        this.missing = new BitSet(rowCount);
        this.missing.set(0, rowCount);
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    /**
     * Decodes the value the reader is positioned on into the given row.
     */
    public final void decode(IonBinaryReader reader, int row) throws IOException {
        missing.clear(row);
        if (type.isNullable() && reader.getType() == IonType.NULL) {
            nulls.set(row);
            return;
        }
        nulls.clear(row);
        decodeValue(reader, row);
    }

    abstract void decodeValue(IonBinaryReader reader, int row) throws IOException;

    /**
     * Packages the decoded values as a frame field.
     */
    public abstract Field toField();

    static final class BooleanValues extends FieldValues {

        private final boolean[] values;

        BooleanValues(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new boolean[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = reader.readBoolean();
        }

        @Override
        public Field toField() {
            return new Field.BooleanField(name, type, Map.of(), values, nulls, missing);
        }
    }

    static final class Int64Values extends FieldValues {

        private final long[] values;

        Int64Values(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new long[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = reader.readLong();
        }

        @Override
        public Field toField() {
            return new Field.LongField(name, type, Map.of(), values, nulls, missing);
        }
    }

    static final class Uint64Values extends FieldValues {

        private final long[] values;

        Uint64Values(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new long[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = reader.readUnsignedLong();
        }

        @Override
        public Field toField() {
            return new Field.LongField(name, type, Map.of(), values, nulls, missing);
        }
    }

    static final class Float64Values extends FieldValues {

        private final double[] values;

        Float64Values(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new double[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = reader.readDouble();
        }

        @Override
        public Field toField() {
            return new Field.DoubleField(name, type, Map.of(), values, nulls, missing);
        }
    }

    static final class TextValues extends FieldValues {

        private final String[] values;

        TextValues(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new String[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = reader.readText();
        }

        @Override
        public Field toField() {
            return new Field.TextField(name, type, Map.of(), values, nulls, missing);
        }
    }

    static final class JsonValues extends FieldValues {

        private final JsonNode[] values;

        JsonValues(String name, FieldType type, int rowCount) {
            super(name, type, rowCount);
            this.values = new JsonNode[rowCount];
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = IonValueProjector.project(reader);
        }

        @Override
        public Field toField() {
            return new Field.JsonField(name, type, Map.of(), values, nulls, missing);
        }
    }

    /**
     * Time values decoded from Ion timestamps, or converted from the designated time field.
     */
    static final class TimeValues extends FieldValues {

        /**
         * How a time value is obtained from the underlying column type.
         */
        enum Source {
            TIMESTAMP,
            EPOCH_MILLIS,
            UNSIGNED_EPOCH_MILLIS,
            RFC_3339
        }

        private final Source source;
        private final Instant[] values;

        TimeValues(String name, FieldType type, int rowCount, Source source) {
            super(name, type, rowCount);
            this.source = source;
            this.values = new Instant[rowCount];
        }

        Source source() {
            return source;
        }

        @Override
        void decodeValue(IonBinaryReader reader, int row) throws IOException {
            values[row] = switch (source) {
                case TIMESTAMP -> reader.readTimestamp();
                case EPOCH_MILLIS -> TimeConversions.fromEpochMillis(reader.readLong());
                case UNSIGNED_EPOCH_MILLIS -> {
                    long millis = reader.readUnsignedLong();
                    if (millis < 0) {
                        throw new FieldConversionException(name, row,
                                Long.toUnsignedString(millis) + " ms is out of range", null);
                    }
                    yield TimeConversions.fromEpochMillis(millis);
                }
                case RFC_3339 -> parse(reader.readText(), row);
            };
        }

        private Instant parse(String text, int row) throws FieldConversionException {
            try {
                return TimeConversions.parseRfc3339(text);
            }
            catch (DateTimeParseException e) {
                throw new FieldConversionException(name, row, "'" + text + "' is not an RFC 3339 date-time", e);
            }
        }

        @Override
        public Field toField() {
            return new Field.TimeField(name, type, Map.of(), values, nulls, missing);
        }
    }
}
