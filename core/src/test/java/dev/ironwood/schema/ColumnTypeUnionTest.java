/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnTypeUnionTest {

    @Test
    void testFirstObservationSetsType() {
        for (ColumnType type : ColumnType.values()) {
            assertThat(ColumnTypeUnion.union(null, type)).isEqualTo(type);
        }
    }

    @Test
    void testNullKeepsType() {
        for (ColumnType type : ColumnType.values()) {
            assertThat(ColumnTypeUnion.union(type, ColumnType.NULL)).isEqualTo(type);
            assertThat(ColumnTypeUnion.union(ColumnType.NULL, type)).isEqualTo(type);
        }
    }

    @Test
    void testSameTypeIsStable() {
        for (ColumnType type : ColumnType.values()) {
            assertThat(ColumnTypeUnion.union(type, type)).isEqualTo(type);
        }
    }

    @Test
    void testConflictingTypesResolveToUnknown() {
        assertThat(ColumnTypeUnion.union(ColumnType.TEXT, ColumnType.NUMBER)).isEqualTo(ColumnType.UNKNOWN);
        assertThat(ColumnTypeUnion.union(ColumnType.RECORD, ColumnType.LIST)).isEqualTo(ColumnType.UNKNOWN);
        assertThat(ColumnTypeUnion.union(ColumnType.UNKNOWN, ColumnType.BOOLEAN)).isEqualTo(ColumnType.UNKNOWN);
        assertThat(ColumnTypeUnion.union(ColumnType.TIMESTAMP, ColumnType.UNKNOWN)).isEqualTo(ColumnType.UNKNOWN);
    }

    @Test
    void testUnionIsCommutative() {
        for (ColumnType a : ColumnType.values()) {
            for (ColumnType b : ColumnType.values()) {
                assertThat(ColumnTypeUnion.union(a, b))
                        .as("%s + %s", a, b)
                        .isEqualTo(ColumnTypeUnion.union(b, a));
            }
        }
    }

    @Test
    void testUnionIsOrderIndependent() {
        List<ColumnType> observed = List.of(ColumnType.NULL, ColumnType.NUMBER, ColumnType.NULL, ColumnType.TEXT);

        ColumnType forward = null;
        for (ColumnType type : observed) {
            forward = ColumnTypeUnion.union(forward, type);
        }
        ColumnType backward = null;
        for (int i = observed.size() - 1; i >= 0; i--) {
            backward = ColumnTypeUnion.union(backward, observed.get(i));
        }

        assertThat(forward).isEqualTo(ColumnType.UNKNOWN);
        assertThat(backward).isEqualTo(forward);
    }
}
