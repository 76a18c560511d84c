/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

/**
 * A named statistic of the query that produced a frame.
 *
 * @param displayName name shown to users
 * @param unit unit of the value, null for plain counts
 * @param value the value
 */
public record QueryStat(String displayName, String unit, long value) {
}
