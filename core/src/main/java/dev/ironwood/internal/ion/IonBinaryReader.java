/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import dev.ironwood.reader.MalformedStreamException;
import dev.ironwood.reader.TypeMismatchException;

/**
 * Pull reader for the binary Ion encoding over an in-memory buffer.
 * Reference: https://amazon-ion.github.io/ion-docs/docs/binary.html
 * <p>
 * The reader exposes one value at a time. {@link #next()} moves to the next value of the
 * current container, {@link #stepIn()} and {@link #stepOut()} descend into and leave structs
 * and lists. Nesting is tracked with an explicit stack of {@link ContainerFrame}s, one per
 * depth, so leaving a container simply resumes the parent cursor behind it and discards any
 * values not read.
 * </p>
 * <p>
 * Version markers and top-level local symbol tables are applied to the reader's
 * {@link SymbolTable} and never surface as values.
 * </p>
 */
public class IonBinaryReader {

    private static final int TC_NULL = 0x0;
    private static final int TC_BOOL = 0x1;
    private static final int TC_NEG_INT = 0x3;
    private static final int TC_STRUCT = 0xD;
    private static final int TC_ANNOTATION = 0xE;
    private static final int TC_RESERVED = 0xF;

    private static final int L_SORTED_STRUCT = 1;
    private static final int L_VAR_LENGTH = 14;
    private static final int L_NULL = 15;

    private static final int VERSION_MARKER = 0xE00100EA;

    // VarUInt/VarInt values wider than 63 bits are rejected
    private static final int MAX_VAR_BYTES = 9;

    private final ByteBuffer buffer;
    private final SymbolTable symbols = new SymbolTable();

    private ContainerFrame[] frames = new ContainerFrame[8];
    private int depth;
    private ContainerFrame current;

    // Scratch offset used while decoding headers and value bodies
    private int cursor;

    /**
     * Creates a reader over the remaining bytes of the given buffer.
     *
     * @param buffer the buffer to read from (position should be at start of data)
     */
    public IonBinaryReader(ByteBuffer buffer) {
        this.buffer = buffer.slice().order(ByteOrder.BIG_ENDIAN);
        this.current = new ContainerFrame();
        this.current.enter(0, this.buffer.limit(), false);
        this.frames[0] = current;
    }

    public IonBinaryReader(byte[] data) {
        this(ByteBuffer.wrap(data));
    }

    // ==================== Navigation ====================

    /**
     * Moves to the next value of the current container.
     *
     * @return false at the end of the container or stream
     * @throws MalformedStreamException if the next value is truncated or its type descriptor is invalid
     */
    public boolean next() throws MalformedStreamException {
        ContainerFrame frame = current;
        while (true) {
            frame.clearValue();
            if (frame.position >= frame.limit) {
                return false;
            }

            cursor = frame.position;
            if (frame.struct) {
                frame.fieldSid = readVarUInt(frame.limit, "field name");
                if (cursor >= frame.limit) {
                    throw truncated("field value");
                }
            }
            else if (depth == 0 && isVersionMarker(frame.limit)) {
                symbols.reset();
                frame.position = cursor + 4;
                continue;
            }

            int end = readHeader(frame, frame.limit);
            frame.position = end;

            if (frame.typeCode == TC_NULL && frame.lengthNibble != L_NULL) {
                // NOP padding
                continue;
            }
            if (frame.typeCode == TC_ANNOTATION && readAnnotationWrapper(frame, end)) {
                continue;
            }

            frame.type = frame.lengthNibble == L_NULL ? IonType.NULL : IonType.fromTypeCode(frame.typeCode);
            return true;
        }
    }

    /**
     * Descends into the current struct, list or s-expression.
     *
     * @throws TypeMismatchException if the current value is not a container
     */
    public void stepIn() throws MalformedStreamException {
        ContainerFrame parent = current;
        if (parent.type == null || !parent.type.isContainer()) {
            throw new TypeMismatchException("struct or list", parent.type, currentFieldName());
        }

        if (depth + 1 == frames.length) {
            frames = Arrays.copyOf(frames, frames.length * 2);
        }
        ContainerFrame child = frames[depth + 1];
        if (child == null) {
            child = new ContainerFrame();
            frames[depth + 1] = child;
        }
        child.enter(parent.bodyStart, parent.bodyStart + parent.bodyLength, parent.type == IonType.STRUCT);

        depth++;
        current = child;
    }

    /**
     * Leaves the current container. Values of the container not read yet are skipped.
     *
     * @throws MalformedStreamException if the reader is at the top level
     */
    public void stepOut() throws MalformedStreamException {
        if (depth == 0) {
            throw new MalformedStreamException("Invalid operation: not inside a nested struct or list");
        }
        depth--;
        current = frames[depth];
    }

    /**
     * Returns the type of the current value, or null if the reader is not positioned on a value.
     */
    public IonType getType() {
        return current.type;
    }

    /**
     * Returns true if the current value is a non-null int or float.
     */
    public boolean isNumeric() {
        return current.type == IonType.INT || current.type == IonType.FLOAT;
    }

    public boolean isFloatingPoint() {
        return current.type == IonType.FLOAT;
    }

    /**
     * Returns true if the current value is a negative integer.
     */
    public boolean isNegativeInt() {
        return current.type == IonType.INT && current.typeCode == TC_NEG_INT;
    }

    public int getDepth() {
        return depth;
    }

    public SymbolTable getSymbolTable() {
        return symbols;
    }

    /**
     * Returns the name of the current field.
     *
     * @throws MalformedStreamException if the reader is not inside a struct or the name cannot be resolved
     */
    public String getFieldName() throws MalformedStreamException {
        if (!current.struct || current.fieldSid < 0) {
            throw new MalformedStreamException("Invalid operation: not inside a struct");
        }
        return resolveSymbol(current.fieldSid, "field name");
    }

    /**
     * Returns the annotations of the current value, empty if there are none.
     */
    public List<String> getAnnotations() throws MalformedStreamException {
        ContainerFrame frame = current;
        if (frame.type == null || frame.annotationCount == 0) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(frame.annotationCount);
        for (int i = 0; i < frame.annotationCount; i++) {
            result.add(resolveSymbol(frame.annotations[i], "annotation"));
        }
        return result;
    }

    // ==================== Typed reads ====================

    public void readNull() throws MalformedStreamException {
        checkType(IonType.NULL);
    }

    public boolean readBoolean() throws MalformedStreamException {
        checkType(IonType.BOOL);
        return current.lengthNibble == 1;
    }

    /**
     * Reads an integer within the signed 64-bit range.
     */
    public long readLong() throws MalformedStreamException {
        checkType(IonType.INT);
        ContainerFrame frame = current;
        if (frame.bodyLength < 8) {
            long magnitude = readUInt(frame.bodyStart, frame.bodyLength);
            return frame.typeCode == TC_NEG_INT ? -magnitude : magnitude;
        }
        BigInteger value = readBigInteger();
        if (value.bitLength() > 63) {
            throw new MalformedStreamException("Integer " + value + " exceeds the signed 64-bit range" + fieldSuffix());
        }
        return value.longValue();
    }

    /**
     * Reads a non-negative integer up to 2^64-1. Values above {@link Long#MAX_VALUE} are
     * returned as their two's complement bit pattern.
     */
    public long readUnsignedLong() throws MalformedStreamException {
        checkType(IonType.INT);
        ContainerFrame frame = current;
        if (frame.typeCode == TC_NEG_INT) {
            throw new MalformedStreamException("Negative integer where an unsigned integer was expected" + fieldSuffix());
        }
        if (frame.bodyLength < 8) {
            return readUInt(frame.bodyStart, frame.bodyLength);
        }
        BigInteger value = readBigInteger();
        if (value.bitLength() > 64) {
            throw new MalformedStreamException("Integer " + value + " exceeds the unsigned 64-bit range" + fieldSuffix());
        }
        return value.longValue();
    }

    public BigInteger readBigInteger() throws MalformedStreamException {
        checkType(IonType.INT);
        BigInteger magnitude = new BigInteger(1, copyBody());
        return current.typeCode == TC_NEG_INT ? magnitude.negate() : magnitude;
    }

    /**
     * Reads a float. Integers are widened to double.
     */
    public double readDouble() throws MalformedStreamException {
        ContainerFrame frame = current;
        if (frame.type == IonType.INT) {
            if (frame.bodyLength < 8) {
                return readLong();
            }
            return readBigInteger().doubleValue();
        }

        checkType(IonType.FLOAT);
        return switch (frame.bodyLength) {
            case 0 -> 0.0d;
            case 4 -> buffer.getFloat(frame.bodyStart);
            case 8 -> buffer.getDouble(frame.bodyStart);
            default -> throw new MalformedStreamException("Invalid float length " + frame.bodyLength + fieldSuffix());
        };
    }

    public BigDecimal readDecimal() throws MalformedStreamException {
        checkType(IonType.DECIMAL);
        ContainerFrame frame = current;
        if (frame.bodyLength == 0) {
            return BigDecimal.ZERO;
        }
        int end = frame.bodyStart + frame.bodyLength;
        cursor = frame.bodyStart;
        long exponent = readVarInt(end, "decimal exponent");
        BigInteger coefficient = readInt(end);
        return new BigDecimal(coefficient, Math.toIntExact(-exponent));
    }

    /**
     * Reads a timestamp. Components are stored in UTC, so the local offset is not needed to
     * compute the instant.
     */
    public Instant readTimestamp() throws MalformedStreamException {
        checkType(IonType.TIMESTAMP);
        ContainerFrame frame = current;
        int end = frame.bodyStart + frame.bodyLength;
        cursor = frame.bodyStart;

        readVarInt(end, "timestamp offset");
        int year = (int) readVarUInt(end, "timestamp year");
        int month = 1;
        int day = 1;
        int hour = 0;
        int minute = 0;
        int second = 0;
        long nanos = 0;

        if (cursor < end) {
            month = (int) readVarUInt(end, "timestamp month");
        }
        if (cursor < end) {
            day = (int) readVarUInt(end, "timestamp day");
        }
        if (cursor < end) {
            hour = (int) readVarUInt(end, "timestamp hour");
            minute = (int) readVarUInt(end, "timestamp minute");
        }
        if (cursor < end) {
            second = (int) readVarUInt(end, "timestamp second");
        }
        if (cursor < end) {
            long exponent = readVarInt(end, "timestamp fraction");
            BigInteger coefficient = cursor < end ? readInt(end) : BigInteger.ZERO;
            nanos = new BigDecimal(coefficient, Math.toIntExact(-exponent)).movePointRight(9).longValue();
        }

        try {
            return LocalDateTime.of(year, month, day, hour, minute, second, Math.toIntExact(nanos))
                    .toInstant(ZoneOffset.UTC);
        }
        catch (DateTimeException | ArithmeticException e) {
            throw new MalformedStreamException("Invalid timestamp" + fieldSuffix() + ": " + e.getMessage(), e);
        }
    }

    public String readString() throws MalformedStreamException {
        checkType(IonType.STRING);
        return new String(copyBody(), StandardCharsets.UTF_8);
    }

    public String readSymbol() throws MalformedStreamException {
        checkType(IonType.SYMBOL);
        return resolveSymbol(readSymbolId(), "symbol value");
    }

    /**
     * Reads a string or a symbol.
     */
    public String readText() throws MalformedStreamException {
        IonType type = current.type;
        if (type == IonType.SYMBOL) {
            return readSymbol();
        }
        if (type == IonType.STRING) {
            return readString();
        }
        throw new TypeMismatchException("text", type, currentFieldName());
    }

    /**
     * Reads a blob or clob.
     */
    public byte[] readBytes() throws MalformedStreamException {
        IonType type = current.type;
        if (type != IonType.BLOB && type != IonType.CLOB) {
            throw new TypeMismatchException(IonType.BLOB.label(), type, currentFieldName());
        }
        return copyBody();
    }

    public Boolean readNullableBoolean() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readBoolean();
    }

    public Long readNullableLong() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readLong();
    }

    public Long readNullableUnsignedLong() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readUnsignedLong();
    }

    public Double readNullableDouble() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readDouble();
    }

    public String readNullableText() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readText();
    }

    public Instant readNullableTimestamp() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readTimestamp();
    }

    public byte[] readNullableBytes() throws MalformedStreamException {
        return current.type == IonType.NULL ? null : readBytes();
    }

    // ==================== Headers ====================

    /**
     * Reads the type descriptor and length at {@link #cursor} into the frame.
     *
     * @return the end offset of the value
     */
    private int readHeader(ContainerFrame frame, int limit) throws MalformedStreamException {
        int descriptor = readByte(limit, "type descriptor");
        int typeCode = descriptor >>> 4;
        int lengthNibble = descriptor & 0x0F;

        int length;
        if (typeCode == TC_RESERVED) {
            throw new MalformedStreamException("Unknown type descriptor 0x" + Integer.toHexString(descriptor)
                    + " at offset " + (cursor - 1));
        }
        else if (lengthNibble == L_NULL) {
            if (typeCode == TC_ANNOTATION) {
                throw new MalformedStreamException("Invalid annotation wrapper at offset " + (cursor - 1));
            }
            length = 0;
        }
        else if (typeCode == TC_BOOL) {
            if (lengthNibble > 1) {
                throw new MalformedStreamException("Invalid boolean representation 0x" + Integer.toHexString(descriptor)
                        + " at offset " + (cursor - 1));
            }
            length = 0;
        }
        else if (lengthNibble == L_VAR_LENGTH || (typeCode == TC_STRUCT && lengthNibble == L_SORTED_STRUCT)) {
            long varLength = readVarUInt(limit, "value length");
            if (varLength > Integer.MAX_VALUE) {
                throw new MalformedStreamException("Value length " + varLength + " out of range at offset " + cursor);
            }
            length = (int) varLength;
        }
        else {
            length = lengthNibble;
        }

        frame.typeCode = typeCode;
        frame.lengthNibble = lengthNibble;
        frame.bodyStart = cursor;
        frame.bodyLength = length;

        if ((long) cursor + length > limit) {
            throw truncated(typeCode == TC_ANNOTATION ? "annotation wrapper" : IonType.fromTypeCode(typeCode).label());
        }
        return cursor + length;
    }

    /**
     * Reads the annotations and the header of the wrapped value.
     *
     * @return true if the wrapper held a local symbol table, which has been applied already
     */
    private boolean readAnnotationWrapper(ContainerFrame frame, int wrapperEnd) throws MalformedStreamException {
        cursor = frame.bodyStart;
        long annotationsLength = readVarUInt(wrapperEnd, "annotation length");
        long annotationsEnd = cursor + annotationsLength;
        if (annotationsLength == 0 || annotationsEnd >= wrapperEnd) {
            throw new MalformedStreamException("Invalid annotation length " + annotationsLength + " at offset " + frame.bodyStart);
        }
        while (cursor < annotationsEnd) {
            frame.addAnnotation(readVarUInt((int) annotationsEnd, "annotation symbol"));
        }

        int valueEnd = readHeader(frame, wrapperEnd);
        if (valueEnd != wrapperEnd) {
            throw new MalformedStreamException("Annotation wrapper length does not match its value at offset " + frame.bodyStart);
        }
        if (frame.typeCode == TC_ANNOTATION || (frame.typeCode == TC_NULL && frame.lengthNibble != L_NULL)) {
            throw new MalformedStreamException("Annotation wrapper without a value at offset " + frame.bodyStart);
        }

        if (depth == 0 && frame.annotations[0] == SymbolTable.ION_SYMBOL_TABLE_SID
                && frame.typeCode == TC_STRUCT && frame.lengthNibble != L_NULL) {
            readLocalSymbolTable(frame);
            return true;
        }
        return false;
    }

    /**
     * Applies the local symbol table the top-level frame is positioned on. A table importing
     * {@code $ion_symbol_table} extends the current symbols, any other table replaces them.
     */
    private void readLocalSymbolTable(ContainerFrame frame) throws MalformedStreamException {
        boolean append = false;
        List<String> localSymbols = new ArrayList<>();

        frame.type = IonType.STRUCT;
        stepIn();
        while (next()) {
            if (current.fieldSid == SymbolTable.IMPORTS_SID) {
                if (current.type == IonType.SYMBOL) {
                    append = readSymbolId() == SymbolTable.ION_SYMBOL_TABLE_SID;
                }
                else if (current.type == IonType.LIST) {
                    throw new MalformedStreamException("Shared symbol table imports are not supported");
                }
            }
            else if (current.fieldSid == SymbolTable.SYMBOLS_SID && current.type == IonType.LIST) {
                stepIn();
                while (next()) {
                    localSymbols.add(current.type == IonType.STRING ? readString() : null);
                }
                stepOut();
            }
        }
        stepOut();

        if (!append) {
            symbols.reset();
        }
        symbols.addAll(localSymbols);
    }

    private boolean isVersionMarker(int limit) {
        return cursor + 4 <= limit && buffer.getInt(cursor) == VERSION_MARKER;
    }

    // ==================== Primitives ====================

    private int readByte(int limit, String what) throws MalformedStreamException {
        if (cursor >= limit) {
            throw truncated(what);
        }
        return buffer.get(cursor++) & 0xFF;
    }

    /**
     * Read a VarUInt: 7 bits per byte, the high bit marks the last byte.
     */
    private long readVarUInt(int limit, String what) throws MalformedStreamException {
        long result = 0;
        for (int i = 0; i < MAX_VAR_BYTES; i++) {
            int b = readByte(limit, what);
            result = (result << 7) | (b & 0x7F);
            if ((b & 0x80) != 0) {
                return result;
            }
        }
        throw new MalformedStreamException("VarUInt too long while reading " + what + " at offset " + cursor);
    }

    /**
     * Read a VarInt: like a VarUInt, with the sign in bit 6 of the first byte.
     */
    private long readVarInt(int limit, String what) throws MalformedStreamException {
        int b = readByte(limit, what);
        boolean negative = (b & 0x40) != 0;
        long magnitude = b & 0x3F;
        int count = 1;
        while ((b & 0x80) == 0) {
            if (++count > MAX_VAR_BYTES) {
                throw new MalformedStreamException("VarInt too long while reading " + what + " at offset " + cursor);
            }
            b = readByte(limit, what);
            magnitude = (magnitude << 7) | (b & 0x7F);
        }
        return negative ? -magnitude : magnitude;
    }

    /**
     * Read a big-endian unsigned integer of at most 8 bytes.
     */
    private long readUInt(int start, int length) {
        long result = 0;
        for (int i = 0; i < length; i++) {
            result = (result << 8) | (buffer.get(start + i) & 0xFF);
        }
        return result;
    }

    /**
     * Read a sign-and-magnitude integer spanning {@link #cursor} up to the given end.
     */
    private BigInteger readInt(int end) {
        int length = end - cursor;
        if (length <= 0) {
            return BigInteger.ZERO;
        }
        byte[] bytes = new byte[length];
        buffer.get(cursor, bytes);
        cursor = end;

        boolean negative = (bytes[0] & 0x80) != 0;
        bytes[0] &= 0x7F;
        BigInteger magnitude = new BigInteger(1, bytes);
        return negative ? magnitude.negate() : magnitude;
    }

    private long readSymbolId() throws MalformedStreamException {
        ContainerFrame frame = current;
        if (frame.bodyLength > 8) {
            throw new MalformedStreamException("Symbol id of " + frame.bodyLength + " bytes is out of range" + fieldSuffix());
        }
        return readUInt(frame.bodyStart, frame.bodyLength);
    }

    private byte[] copyBody() {
        byte[] body = new byte[current.bodyLength];
        buffer.get(current.bodyStart, body);
        return body;
    }

    // ==================== Errors ====================

    private void checkType(IonType expected) throws TypeMismatchException {
        if (current.type != expected) {
            throw new TypeMismatchException(expected.label(), current.type, currentFieldName());
        }
    }

    private String resolveSymbol(long sid, String role) throws MalformedStreamException {
        String text = symbols.lookup(sid);
        if (text == null) {
            throw new MalformedStreamException("Symbol " + sid + " (" + role + ") not in symbol table");
        }
        return text;
    }

    /**
     * Name of the current field for error messages, null if unknown.
     */
    private String currentFieldName() {
        if (!current.struct || current.fieldSid < 0) {
            return null;
        }
        return symbols.lookup(current.fieldSid);
    }

    private String fieldSuffix() {
        String name = currentFieldName();
        return name != null ? " for field '" + name + "'" : "";
    }

    private MalformedStreamException truncated(String what) {
        return new MalformedStreamException("Unexpected EOF while reading " + what + " at offset " + cursor);
    }
}
