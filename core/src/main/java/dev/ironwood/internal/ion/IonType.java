/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

/**
 * Value types of the binary Ion encoding, as reported by {@link IonBinaryReader#getType()}.
 * Positive and negative integers share {@link #INT}; typed nulls (e.g. {@code null.int}) are
 * reported as {@link #NULL}.
 */
public enum IonType {
    NULL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    DECIMAL("decimal"),
    TIMESTAMP("timestamp"),
    SYMBOL("symbol"),
    STRING("string"),
    CLOB("clob"),
    BLOB("blob"),
    LIST("list"),
    SEXP("sexp"),
    STRUCT("struct");

    private final String label;

    IonType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isContainer() {
        return this == LIST || this == SEXP || this == STRUCT;
    }

    public boolean isText() {
        return this == SYMBOL || this == STRING;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * Maps the high nibble of a type descriptor to its value type.
     *
     * @throws IllegalArgumentException for the annotation wrapper and reserved codes, which
     *         never denote a value on their own
     */
    static IonType fromTypeCode(int typeCode) {
        return switch (typeCode) {
            case 0x0 -> NULL;
            case 0x1 -> BOOL;
            case 0x2, 0x3 -> INT;
            case 0x4 -> FLOAT;
            case 0x5 -> DECIMAL;
            case 0x6 -> TIMESTAMP;
            case 0x7 -> SYMBOL;
            case 0x8 -> STRING;
            case 0x9 -> CLOB;
            case 0xA -> BLOB;
            case 0xB -> LIST;
            case 0xC -> SEXP;
            case 0xD -> STRUCT;
            default -> throw new IllegalArgumentException("Not a value type code: " + typeCode);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
