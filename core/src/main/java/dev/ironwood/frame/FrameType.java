/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.frame;

/**
 * Shape of a frame.
 */
public enum FrameType {
    TABLE,
    /** One time field, numeric or boolean value fields. */
    TIME_SERIES_WIDE,
    /** One time field, value fields and text fields acting as factors. */
    TIME_SERIES_LONG
}
