/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

/**
 * Value representation of a frame field. Each representation comes in a plain and a nullable
 * variant, declared in that order.
 */
public enum FieldType {
    JSON(false),
    NULLABLE_JSON(true),
    BOOLEAN(false),
    NULLABLE_BOOLEAN(true),
    INT64(false),
    NULLABLE_INT64(true),
    UINT64(false),
    NULLABLE_UINT64(true),
    FLOAT64(false),
    NULLABLE_FLOAT64(true),
    TEXT(false),
    NULLABLE_TEXT(true),
    TIME(false),
    NULLABLE_TIME(true);

    private final boolean nullable;

    FieldType(boolean nullable) {
        this.nullable = nullable;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * Returns the plain or nullable variant of this representation.
     */
    public FieldType withNullable(boolean nullable) {
        if (this.nullable == nullable) {
            return this;
        }
        return values()[nullable ? ordinal() + 1 : ordinal() - 1];
    }

    /**
     * Returns the plain variant of this representation.
     */
    public FieldType base() {
        return withNullable(false);
    }

    public boolean isNumeric() {
        FieldType base = base();
        return base == INT64 || base == UINT64 || base == FLOAT64;
    }

    public boolean isBoolean() {
        return base() == BOOLEAN;
    }

    public boolean isText() {
        return base() == TEXT;
    }

    public boolean isTime() {
        return base() == TIME;
    }
}
