/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

import java.util.List;

import dev.ironwood.metadata.QueryStats;

/**
 * Metadata attached to a frame.
 *
 * @param type the shape of the frame
 * @param preferredVisualization how the frame is best presented
 * @param executedQuery the query text that produced the frame
 * @param stats execution statistics
 */
public record FrameMeta(FrameType type, Visualization preferredVisualization, String executedQuery, List<QueryStat> stats) {

    public FrameMeta {
        stats = List.copyOf(stats);
    }

    /**
     * Converts the statistics of a final status into displayable statistics.
     */
    public static List<QueryStat> toQueryStats(QueryStats stats) {
        return List.of(
                new QueryStat("Hits", null, stats.hits()),
                new QueryStat("Misses", null, stats.misses()),
                new QueryStat("Scanned", "bytes", stats.scanned()));
    }

    public FrameMeta withShape(FrameType type, Visualization preferredVisualization) {
        return new FrameMeta(type, preferredVisualization, executedQuery, stats);
    }
}
