/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.metadata;

/**
 * Execution statistics reported by the final status of a query.
 *
 * @param hits number of cache hits
 * @param misses number of cache misses
 * @param scanned number of bytes scanned
 */
public record QueryStats(long hits, long misses, long scanned) {

    public static final QueryStats EMPTY = new QueryStats(0, 0, 0);
}
