/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

/**
 * Derived description of one result column.
 *
 * @param name the field name
 * @param type the resolved type over all rows
 * @param nullable at least one row holds a null for this field
 * @param optional at least one row lacks this field
 * @param floating at least one value is a float
 * @param signed at least one value is a negative integer or a float
 * @param ordinal position of the column, or -1 if it is not stable across rows
 * @param firstSeenIndex order in which the column was first encountered
 * @param observedRows number of rows holding this field
 */
public record ColumnDescriptor(
        String name,
        ColumnType type,
        boolean nullable,
        boolean optional,
        boolean floating,
        boolean signed,
        int ordinal,
        int firstSeenIndex,
        int observedRows) {

    /**
     * Returns true if rows may lack a value for this column, either null or missing.
     */
    public boolean acceptsAbsentValues() {
        return nullable || optional;
    }
}
