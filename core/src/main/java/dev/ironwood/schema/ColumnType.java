/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

import dev.ironwood.internal.ion.IonType;

/**
 * Resolved type of a result column.
 */
public enum ColumnType {
    /** Conflicting or unsupported value types; materialized as JSON. */
    UNKNOWN,
    /** Only nulls have been observed. */
    NULL,
    BOOLEAN,
    NUMBER,
    TIMESTAMP,
    TEXT,
    RECORD,
    LIST;

    /**
     * Maps the type of a single value to a column type.
     */
    public static ColumnType of(IonType type) {
        return switch (type) {
            case NULL -> NULL;
            case BOOL -> BOOLEAN;
            case INT, FLOAT -> NUMBER;
            case TIMESTAMP -> TIMESTAMP;
            case SYMBOL, STRING -> TEXT;
            case STRUCT -> RECORD;
            case LIST -> LIST;
            default -> UNKNOWN;
        };
    }
}
