/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

import java.util.List;

/**
 * Immutable lookup from column name to column position, consulted for every field of every
 * row during materialization. Slots are probed linearly; each slot keeps the name's hash so
 * most mismatches are rejected without comparing strings.
 */
final class ColumnNameIndex {

    private static final int NOT_FOUND = -1;

    private final String[] names;
    private final int[] hashes;
    private final int[] positions;
    private final int mask;

    ColumnNameIndex(List<ColumnDescriptor> columns) {
        // at most half full
        int slots = Integer.highestOneBit(Math.max(columns.size(), 4) * 2 - 1) << 1;
        this.names = new String[slots];
        this.hashes = new int[slots];
        this.positions = new int[slots];
        this.mask = slots - 1;

        for (int position = 0; position < columns.size(); position++) {
            String name = columns.get(position).name();
            int hash = spread(name.hashCode());
            int slot = hash & mask;
            while (names[slot] != null) {
                if (hashes[slot] == hash && names[slot].equals(name)) {
                    throw new IllegalArgumentException("Duplicate column name: " + name);
                }
                slot = (slot + 1) & mask;
            }
            names[slot] = name;
            hashes[slot] = hash;
            positions[slot] = position;
        }
    }

    /**
     * Returns the position of the named column, or -1 if there is none.
     */
    int positionOf(String name) {
        int hash = spread(name.hashCode());
        for (int slot = hash & mask; names[slot] != null; slot = (slot + 1) & mask) {
            if (hashes[slot] == hash && names[slot].equals(name)) {
                return positions[slot];
            }
        }
        return NOT_FOUND;
    }

    private static int spread(int hash) {
        return hash ^ (hash >>> 16);
    }
}
