/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

import java.util.List;
import java.util.Map;

/**
 * Decoded query result: equal-length typed fields plus metadata.
 */
public class Frame {

    private static final int MAX_PRINTED_ROWS = 20;

    private final String name;
    private final List<Field> fields;
    private final int rowCount;
    private final FrameMeta meta;

    public Frame(String name, List<Field> fields, int rowCount, FrameMeta meta) {
        for (Field field : fields) {
            if (field.size() != rowCount) {
                throw new IllegalArgumentException("Field '" + field.name() + "' has " + field.size()
                        + " values, expected " + rowCount);
            }
        }
        this.name = name;
        this.fields = List.copyOf(fields);
        this.rowCount = rowCount;
        this.meta = meta;
    }

    /**
     * Returns the frame name, the reference id of the query that produced it.
     */
    public String getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    /**
     * Returns the first field of the given name.
     */
    public Field getField(String name) {
        for (Field field : fields) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Field not found: " + name);
    }

    public int getFieldCount() {
        return fields.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    public FrameMeta getMeta() {
        return meta;
    }

    public Frame withMeta(FrameMeta meta) {
        return new Frame(name, fields, rowCount, meta);
    }

    /**
     * Renders the frame as a text table, limited to the first rows.
     */
    @Override
    public String toString() {
        int columns = fields.size();
        int printedRows = Math.min(rowCount, MAX_PRINTED_ROWS);
        String[][] cells = new String[printedRows + 2][columns];

        for (int c = 0; c < columns; c++) {
            Field field = fields.get(c);
            cells[0][c] = header(field);
            cells[1][c] = field.type().name();
            for (int r = 0; r < printedRows; r++) {
                cells[r + 2][c] = field.isMissing(r) ? "" : String.valueOf(field.getValue(r));
            }
        }

        int[] widths = new int[columns];
        for (String[] row : cells) {
            for (int c = 0; c < columns; c++) {
                widths[c] = Math.max(widths[c], row[c].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Frame[name=").append(name)
                .append(", rows=").append(rowCount)
                .append(", type=").append(meta != null ? meta.type() : null)
                .append("]\n");
        for (String[] row : cells) {
            for (int c = 0; c < columns; c++) {
                sb.append(c == 0 ? "| " : " | ");
                sb.append(row[c]).append(" ".repeat(widths[c] - row[c].length()));
            }
            sb.append(columns > 0 ? " |\n" : "\n");
        }
        if (rowCount > printedRows) {
            sb.append("... ").append(rowCount - printedRows).append(" more rows\n");
        }
        return sb.toString();
    }

    private static String header(Field field) {
        Map<String, String> labels = field.labels();
        return labels.isEmpty() ? field.name() : field.name() + " " + labels;
    }
}
