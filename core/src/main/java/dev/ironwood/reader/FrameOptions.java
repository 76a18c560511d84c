/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

/**
 * Per-query options for building a frame.
 *
 * @param refId reference id of the query, used as the frame name
 * @param executedQuery the query text as sent to the engine, reported in the frame metadata
 * @param timeField name of the field holding the time of each row, null for none
 * @param longToWide whether long time series are pivoted into wide ones
 */
public record FrameOptions(String refId, String executedQuery, String timeField, boolean longToWide) {

    public static FrameOptions defaults() {
        return new FrameOptions("", "", null, true);
    }

    public FrameOptions withRefId(String refId) {
        return new FrameOptions(refId, executedQuery, timeField, longToWide);
    }

    public FrameOptions withExecutedQuery(String executedQuery) {
        return new FrameOptions(refId, executedQuery, timeField, longToWide);
    }

    public FrameOptions withTimeField(String timeField) {
        return new FrameOptions(refId, executedQuery, timeField, longToWide);
    }

    public FrameOptions withLongToWide(boolean longToWide) {
        return new FrameOptions(refId, executedQuery, timeField, longToWide);
    }
}
