/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.ironwood.internal.ion.IonBinaryReader;
import dev.ironwood.internal.ion.IonType;
import dev.ironwood.internal.reader.RowCallback;
import dev.ironwood.internal.reader.RowIterator;
import dev.ironwood.metadata.StatusEnvelope;

/**
 * First pass over a query result: derives one {@link ColumnDescriptor} per distinct field
 * name from the types observed across all rows.
 * <p>
 * Columns are ordered by the field order of the {@code result_set} reported in the final
 * status if there is one; columns it does not name follow in the order they were first seen.
 * Without a {@code result_set} all columns keep first-seen order.
 * </p>
 */
public final class SchemaDeriver implements RowCallback {

    private static final System.Logger LOG = System.getLogger(SchemaDeriver.class.getName());

    private final Map<String, ColumnState> columnsByName = new HashMap<>();
    private final List<ColumnState> columns = new ArrayList<>();
    private int rowCount;

    private SchemaDeriver() {
    }

    /**
     * Derives the schema of the result stream driven by the given iterator.
     */
    public static ResultSchema derive(RowIterator rows) throws IOException {
        SchemaDeriver deriver = new SchemaDeriver();
        StatusEnvelope status = rows.forEachRow(deriver);
        ResultSchema schema = deriver.toSchema(status);

        LOG.log(System.Logger.Level.DEBUG, "Derived schema: {0}", schema);
        return schema;
    }

    @Override
    public void accept(IonBinaryReader reader, int rowIndex) throws IOException {
        rowCount++;
        int position = 0;
        while (reader.next()) {
            String name = reader.getFieldName();
            ColumnState column = columnsByName.get(name);
            if (column == null) {
                column = new ColumnState(name, position, columns.size());
                columnsByName.put(name, column);
                columns.add(column);
            }
            else if (column.ordinal != position) {
                column.ordinal = -1;
            }
            column.observe(reader, rowIndex);
            position++;
        }
    }

    private ResultSchema toSchema(StatusEnvelope status) {
        List<String> order = status instanceof StatusEnvelope.Success success ? success.columnOrder() : List.of();

        List<ColumnDescriptor> descriptors = new ArrayList<>(columns.size());
        if (order.isEmpty()) {
            for (ColumnState column : columns) {
                descriptors.add(column.toDescriptor(column.ordinal, rowCount));
            }
            return new ResultSchema(rowCount, descriptors, status);
        }

        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            positions.putIfAbsent(order.get(i), i);
        }
        for (ColumnState column : columns) {
            Integer position = positions.get(column.name);
            descriptors.add(column.toDescriptor(position != null ? position : -1, rowCount));
        }

        // List.sort is stable, so columns outside of the result set keep first-seen order
        descriptors.sort(Comparator.comparingInt(SchemaDeriver::sortKey));
        return new ResultSchema(rowCount, descriptors, status);
    }

    private static int sortKey(ColumnDescriptor descriptor) {
        return descriptor.ordinal() < 0 ? Integer.MAX_VALUE : descriptor.ordinal();
    }

    /**
     * Mutable per-column state during the pass.
     */
    private static final class ColumnState {

        final String name;
        final int firstSeenIndex;
        int ordinal;
        ColumnType type;
        boolean nullable;
        boolean floating;
        boolean signed;
        int observedRows;
        int lastRow = -1;

        ColumnState(String name, int ordinal, int firstSeenIndex) {
            this.name = name;
            this.ordinal = ordinal;
            this.firstSeenIndex = firstSeenIndex;
        }

        void observe(IonBinaryReader reader, int rowIndex) {
            IonType ionType = reader.getType();
            ColumnType observed = ColumnType.of(ionType);

            type = ColumnTypeUnion.union(type, observed);
            if (observed == ColumnType.NULL) {
                nullable = true;
            }
            if (ionType == IonType.FLOAT) {
                floating = true;
                signed = true;
            }
            else if (reader.isNegativeInt()) {
                signed = true;
            }

            // A field repeated within one row counts once
            if (lastRow != rowIndex) {
                lastRow = rowIndex;
                observedRows++;
            }
        }

        ColumnDescriptor toDescriptor(int resolvedOrdinal, int rowCount) {
            return new ColumnDescriptor(name, type, nullable, observedRows < rowCount, floating, signed,
                    resolvedOrdinal, firstSeenIndex, observedRows);
        }
    }
}
