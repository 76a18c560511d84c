/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

/**
 * Combines the column type derived so far with the type of one more observed value.
 * <p>
 * Null never changes a typed column, a non-null type replaces null, and two different
 * non-null types resolve to {@link ColumnType#UNKNOWN}, which absorbs everything. The result
 * is therefore independent of the order in which values are observed. Whether a null was
 * seen is tracked separately as the column's nullability.
 * </p>
 */
final class ColumnTypeUnion {

    private static final ColumnType X = ColumnType.UNKNOWN;
    private static final ColumnType N = ColumnType.NULL;
    private static final ColumnType B = ColumnType.BOOLEAN;
    private static final ColumnType D = ColumnType.NUMBER;
    private static final ColumnType T = ColumnType.TIMESTAMP;
    private static final ColumnType S = ColumnType.TEXT;
    private static final ColumnType R = ColumnType.RECORD;
    private static final ColumnType L = ColumnType.LIST;

    // Rows: current type, columns: observed type, both in ColumnType declaration order
    private static final ColumnType[][] TRANSITIONS = {
            //         UNKNOWN NULL BOOLEAN NUMBER TIMESTAMP TEXT RECORD LIST
            /* UNKNOWN   */ { X, X, X, X, X, X, X, X },
            /* NULL      */ { X, N, B, D, T, S, R, L },
            /* BOOLEAN   */ { X, B, B, X, X, X, X, X },
            /* NUMBER    */ { X, D, X, D, X, X, X, X },
            /* TIMESTAMP */ { X, T, X, X, T, X, X, X },
            /* TEXT      */ { X, S, X, X, X, S, X, X },
            /* RECORD    */ { X, R, X, X, X, X, R, X },
            /* LIST      */ { X, L, X, X, X, X, X, L },
    };

    private ColumnTypeUnion() {
    }

    /**
     * Returns the union of the current column type and an observed value type.
     *
     * @param current the type derived so far, null if no value has been observed yet
     */
    static ColumnType union(ColumnType current, ColumnType observed) {
        if (current == null) {
            return observed;
        }
        return TRANSITIONS[current.ordinal()][observed.ordinal()];
    }
}
