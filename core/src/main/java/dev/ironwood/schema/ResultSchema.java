/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.schema;

import java.util.List;

import dev.ironwood.metadata.StatusEnvelope;

/**
 * Schema derived from a query result: the row count, the columns in presentation order and
 * the terminal status envelope.
 */
public class ResultSchema {

    private final int rowCount;
    private final List<ColumnDescriptor> columns;
    private final StatusEnvelope status;
    private final ColumnNameIndex columnIndex;

    public ResultSchema(int rowCount, List<ColumnDescriptor> columns, StatusEnvelope status) {
        this.rowCount = rowCount;
        this.columns = List.copyOf(columns);
        this.status = status;

        this.columnIndex = new ColumnNameIndex(this.columns);
    }

    public int getRowCount() {
        return rowCount;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public ColumnDescriptor getColumn(int index) {
        return columns.get(index);
    }

    public ColumnDescriptor getColumn(String name) {
        int index = columnIndex.positionOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    /**
     * Returns the index of the named column, or -1 if there is no such column.
     */
    public int getColumnIndex(String name) {
        return columnIndex.positionOf(name);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public StatusEnvelope getStatus() {
        return status;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ResultSchema[rows=").append(rowCount);
        for (ColumnDescriptor column : columns) {
            sb.append(", ").append(column.name()).append(':').append(column.type());
            if (column.nullable()) {
                sb.append('?');
            }
            if (column.optional()) {
                sb.append('~');
            }
        }
        return sb.append(']').toString();
    }
}
