/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

import java.util.ArrayList;
import java.util.List;

/**
 * Time-series shape of a list of fields.
 * <p>
 * The first time field is the time index. The frame is a wide time series if every other field
 * is numeric or boolean and there is at least one such field, and a long time series if text
 * fields act as factors in addition. Any other field, including a second time field, makes it a
 * plain table.
 * </p>
 *
 * @param type the detected shape
 * @param timeIndex index of the time field, -1 for tables
 * @param valueIndices indices of the numeric and boolean fields
 * @param factorIndices indices of the text fields
 */
public record TimeSeriesSchema(FrameType type, int timeIndex, List<Integer> valueIndices, List<Integer> factorIndices) {

    private static final TimeSeriesSchema TABLE = new TimeSeriesSchema(FrameType.TABLE, -1, List.of(), List.of());

    public TimeSeriesSchema {
        valueIndices = List.copyOf(valueIndices);
        factorIndices = List.copyOf(factorIndices);
    }

    public static TimeSeriesSchema of(List<Field> fields) {
        int timeIndex = -1;
        List<Integer> values = new ArrayList<>();
        List<Integer> factors = new ArrayList<>();

        for (int i = 0; i < fields.size(); i++) {
            FieldType type = fields.get(i).type();
            if (type.isTime() && timeIndex < 0) {
                timeIndex = i;
            }
            else if (type.isNumeric() || type.isBoolean()) {
                values.add(i);
            }
            else if (type.isText()) {
                factors.add(i);
            }
            else {
                return TABLE;
            }
        }

        if (timeIndex < 0 || values.isEmpty()) {
            return TABLE;
        }
        FrameType type = factors.isEmpty() ? FrameType.TIME_SERIES_WIDE : FrameType.TIME_SERIES_LONG;
        return new TimeSeriesSchema(type, timeIndex, values, factors);
    }

    public boolean isTimeSeries() {
        return type != FrameType.TABLE;
    }
}
