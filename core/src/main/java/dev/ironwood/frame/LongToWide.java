/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pivots a long time series into a wide one.
 * <p>
 * The result has one row per distinct time and, for every combination of factor values in the
 * order of first appearance, one nullable field per value field labelled with those factor
 * values. Cells without a matching input row are null; if several input rows share a time and
 * factor combination, the last one wins. A null factor value is labelled with the empty string.
 * </p>
 */
public final class LongToWide {

    private LongToWide() {
    }

    /**
     * Converts the given long frame.
     *
     * @throws IllegalArgumentException if the frame is not a long time series, or if its times
     *         are null or not sorted in ascending order
     */
    public static Frame convert(Frame frame) {
        List<Field> fields = frame.getFields();
        TimeSeriesSchema schema = TimeSeriesSchema.of(fields);
        if (schema.type() != FrameType.TIME_SERIES_LONG) {
            throw new IllegalArgumentException("Frame is not a long time series but " + schema.type());
        }

        Field timeField = fields.get(schema.timeIndex());
        int rowCount = frame.getRowCount();

        // Distinct times, one output row each
        List<Instant> times = new ArrayList<>();
        int[] outputRow = new int[rowCount];
        for (int row = 0; row < rowCount; row++) {
            Instant time = (Instant) timeField.getValue(row);
            if (time == null) {
                throw new IllegalArgumentException("Time field '" + timeField.name() + "' has no value in row " + row);
            }
            Instant previous = times.isEmpty() ? null : times.get(times.size() - 1);
            if (previous != null && time.isBefore(previous)) {
                throw new IllegalArgumentException("Long frame must be sorted ascending by time, row " + row
                        + " is before its predecessor");
            }
            if (previous == null || time.isAfter(previous)) {
                times.add(time);
            }
            outputRow[row] = times.size() - 1;
        }

        // Factor combinations in order of first appearance
        Map<List<String>, Integer> seriesIndex = new HashMap<>();
        List<List<String>> series = new ArrayList<>();
        int[] seriesOfRow = new int[rowCount];
        for (int row = 0; row < rowCount; row++) {
            List<String> key = new ArrayList<>(schema.factorIndices().size());
            for (int factor : schema.factorIndices()) {
                Object value = fields.get(factor).getValue(row);
                key.add(value != null ? (String) value : "");
            }
            Integer index = seriesIndex.get(key);
            if (index == null) {
                index = series.size();
                seriesIndex.put(key, index);
                series.add(key);
            }
            seriesOfRow[row] = index;
        }

        List<Field> result = new ArrayList<>();
        result.add(Field.of(timeField.name(), FieldType.TIME, timeField.labels(), times.toArray()));

        for (int s = 0; s < series.size(); s++) {
            Map<String, String> labels = new LinkedHashMap<>();
            for (int f = 0; f < schema.factorIndices().size(); f++) {
                labels.put(fields.get(schema.factorIndices().get(f)).name(), series.get(s).get(f));
            }
            for (int valueIndex : schema.valueIndices()) {
                Field source = fields.get(valueIndex);
                Object[] cells = new Object[times.size()];
                for (int row = 0; row < rowCount; row++) {
                    if (seriesOfRow[row] == s) {
                        cells[outputRow[row]] = source.getValue(row);
                    }
                }
                result.add(Field.of(source.name(), source.type().withNullable(true), labels, cells));
            }
        }

        FrameMeta meta = frame.getMeta() != null
                ? frame.getMeta().withShape(FrameType.TIME_SERIES_WIDE, Visualization.GRAPH)
                : null;
        return new Frame(frame.getName(), result, times.size(), meta);
    }
}
