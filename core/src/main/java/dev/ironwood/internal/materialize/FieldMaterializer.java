/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.materialize;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import dev.ironwood.frame.Field;
import dev.ironwood.frame.FieldType;
import dev.ironwood.internal.reader.RowIterator;
import dev.ironwood.schema.ColumnDescriptor;
import dev.ironwood.schema.ResultSchema;

/**
 * Second pass over a query result: decodes every row into the typed value arrays of the
 * derived schema.
 */
public final class FieldMaterializer {

    private static final System.Logger LOG = System.getLogger(FieldMaterializer.class.getName());

    private FieldMaterializer() {
    }

    /**
     * Returns the field representation of a column, ignoring any time field designation.
     */
    public static FieldType targetType(ColumnDescriptor column) {
        FieldType base = switch (column.type()) {
            case UNKNOWN, NULL, RECORD, LIST -> FieldType.JSON;
            case BOOLEAN -> FieldType.BOOLEAN;
            case NUMBER -> column.floating() ? FieldType.FLOAT64 : column.signed() ? FieldType.INT64 : FieldType.UINT64;
            case TIMESTAMP -> FieldType.TIME;
            case TEXT -> FieldType.TEXT;
        };
        return base.withNullable(column.acceptsAbsentValues());
    }

    /**
     * Creates the value array for a column. The designated time field becomes a time field if
     * the column holds text or integers; otherwise the designation is ignored.
     *
     * @param timeField name of the designated time field, may be null
     */
    public static FieldValues bind(ColumnDescriptor column, int rowCount, String timeField) {
        String name = column.name();
        FieldType target = targetType(column);

        if (name.equals(timeField)) {
            FieldType timeType = FieldType.TIME.withNullable(target.isNullable());
            switch (target.base()) {
                case TEXT:
                    return new FieldValues.TimeValues(name, timeType, rowCount, FieldValues.TimeValues.Source.RFC_3339);
                case INT64:
                    return new FieldValues.TimeValues(name, timeType, rowCount, FieldValues.TimeValues.Source.EPOCH_MILLIS);
                case UINT64:
                    return new FieldValues.TimeValues(name, timeType, rowCount, FieldValues.TimeValues.Source.UNSIGNED_EPOCH_MILLIS);
                default:
                    LOG.log(System.Logger.Level.DEBUG, "Ignoring time field designation of column ''{0}'' with type {1}",
                            name, target);
            }
        }

        return switch (target) {
            case JSON, NULLABLE_JSON -> new FieldValues.JsonValues(name, target, rowCount);
            case BOOLEAN, NULLABLE_BOOLEAN -> new FieldValues.BooleanValues(name, target, rowCount);
            case INT64, NULLABLE_INT64 -> new FieldValues.Int64Values(name, target, rowCount);
            case UINT64, NULLABLE_UINT64 -> new FieldValues.Uint64Values(name, target, rowCount);
            case FLOAT64, NULLABLE_FLOAT64 -> new FieldValues.Float64Values(name, target, rowCount);
            case TEXT, NULLABLE_TEXT -> new FieldValues.TextValues(name, target, rowCount);
            case TIME, NULLABLE_TIME -> new FieldValues.TimeValues(name, target, rowCount, FieldValues.TimeValues.Source.TIMESTAMP);
        };
    }

    /**
     * Decodes all columns in a single pass over the rows.
     */
    public static List<Field> materialize(RowIterator rows, ResultSchema schema, String timeField) throws IOException {
        int rowCount = schema.getRowCount();
        FieldValues[] values = new FieldValues[schema.getColumnCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = bind(schema.getColumn(i), rowCount, timeField);
        }

        rows.forEachRow((reader, row) -> {
            while (reader.next()) {
                int index = schema.getColumnIndex(reader.getFieldName());
                if (index >= 0) {
                    values[index].decode(reader, row);
                }
            }
        });

        return toFields(values);
    }

    /**
     * Decodes each column in its own pass over the rows, running the passes on the given executor.
     * The first failing pass aborts the others: passes not yet started are cancelled and running
     * passes stop at their next row.
     */
    public static List<Field> materialize(RowIterator rows, ResultSchema schema, String timeField, Executor executor)
            throws IOException {
        int rowCount = schema.getRowCount();
        int columnCount = schema.getColumnCount();
        List<CompletableFuture<FieldValues>> futures = new ArrayList<>(columnCount);
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        AtomicBoolean aborted = new AtomicBoolean();

        for (int i = 0; i < columnCount && !aborted.get(); i++) {
            ColumnDescriptor column = schema.getColumn(i);
            CompletableFuture<FieldValues> future = CompletableFuture.supplyAsync(
                    () -> decodeColumn(rows, column, rowCount, timeField, aborted), executor);
            future.whenComplete((values, failure) -> {
                if (failure != null && firstFailure.completeExceptionally(unwrap(failure))) {
                    aborted.set(true);
                }
            });
            futures.add(future);
        }

        try {
            CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
            CompletableFuture.anyOf(firstFailure, all).join();
        }
        catch (CompletionException e) {
            for (CompletableFuture<FieldValues> future : futures) {
                future.cancel(false);
            }
            Throwable cause = unwrap(e);
            LOG.log(System.Logger.Level.DEBUG, "Aborted parallel materialization of {0} columns: {1}", columnCount, cause);
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        FieldValues[] values = new FieldValues[columnCount];
        for (int i = 0; i < columnCount; i++) {
            values[i] = futures.get(i).join();
        }
        return toFields(values);
    }

    private static FieldValues decodeColumn(RowIterator rows, ColumnDescriptor column, int rowCount, String timeField,
                                            AtomicBoolean aborted) {
        FieldValues values = bind(column, rowCount, timeField);
        try {
            rows.forEachRow((reader, row) -> {
                if (aborted.get()) {
                    throw new CancellationException("Decoding of column '" + column.name() + "' aborted at row " + row);
                }
                while (reader.next()) {
                    if (reader.getFieldName().equals(column.name())) {
                        values.decode(reader, row);
                    }
                }
            });
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return values;
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private static List<Field> toFields(FieldValues[] values) {
        List<Field> fields = new ArrayList<>(values.length);
        for (FieldValues value : values) {
            fields.add(value.toField());
        }
        return fields;
    }
}
