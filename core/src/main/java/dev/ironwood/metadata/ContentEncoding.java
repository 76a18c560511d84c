/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.metadata;

import java.util.Locale;

/**
 * HTTP content encodings a query result body may arrive with, for callers whose HTTP client
 * does not undo the encoding itself.
 */
public enum ContentEncoding {
    IDENTITY("identity"),
    GZIP("gzip");

    private final String headerValue;

    ContentEncoding(String headerValue) {
        this.headerValue = headerValue;
    }

    public String getHeaderValue() {
        return headerValue;
    }

    /**
     * Parses a {@code Content-Encoding} header value. A missing or blank value means
     * {@link #IDENTITY}; {@code x-gzip} is accepted as an alias of {@link #GZIP}.
     *
     * @throws IllegalArgumentException if the encoding is unknown or more than one encoding is listed
     */
    public static ContentEncoding fromHeaderValue(String value) {
        if (value == null || value.isBlank()) {
            return IDENTITY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("x-gzip")) {
            return GZIP;
        }
        for (ContentEncoding encoding : values()) {
            if (encoding.headerValue.equals(normalized)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown content encoding: " + value);
    }
}
