/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.metadata;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The terminal top-level value of a query result stream, either the final status of a
 * successful query or the error of a failed one.
 */
public sealed interface StatusEnvelope {

    /**
     * Returns true if the query failed upstream.
     */
    boolean isFailure();

    /**
     * Final status of a successful query.
     *
     * @param stats execution statistics
     * @param resultSet raw projection of the {@code result_set} field, null if absent
     * @param columnOrder field names of {@code result_set} if it is a struct, empty otherwise
     */
    record Success(QueryStats stats, JsonNode resultSet, List<String> columnOrder) implements StatusEnvelope {

        public Success {
            columnOrder = List.copyOf(columnOrder);
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Error reported by the query engine.
     *
     * @param message the upstream error message
     * @param annotation the annotation of the envelope that carried it
     */
    record Failure(String message, String annotation) implements StatusEnvelope {

        @Override
        public boolean isFailure() {
            return true;
        }
    }
}
