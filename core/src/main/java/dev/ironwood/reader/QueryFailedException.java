/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import java.io.IOException;

/**
 * The query itself failed; its terminal status envelope carries the error reported upstream.
 */
public class QueryFailedException extends IOException {

    private final String upstreamMessage;

    public QueryFailedException(String upstreamMessage) {
        super("query execution failed: '" + upstreamMessage + "'");
        this.upstreamMessage = upstreamMessage;
    }

    public String getUpstreamMessage() {
        return upstreamMessage;
    }
}
