/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.reader;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ironwood.internal.ion.IonBinaryReader;
import dev.ironwood.internal.ion.IonType;
import dev.ironwood.internal.ion.IonValueProjector;
import dev.ironwood.metadata.QueryStats;
import dev.ironwood.metadata.StatusEnvelope;
import dev.ironwood.reader.MalformedStreamException;

/**
 * Decodes the annotated structs terminating a result stream. Unknown fields are skipped.
 */
final class StatusEnvelopeReader {

    static final String FINAL_STATUS = "final_status";
    static final String QUERY_ERROR = "query_error";

    private StatusEnvelopeReader() {
    }

    /**
     * Reads {@code final_status::{hits, misses, scanned, error, result_set}}. A non-empty
     * {@code error} turns the envelope into a failure.
     */
    static StatusEnvelope readFinalStatus(IonBinaryReader reader) throws MalformedStreamException {
        long hits = 0;
        long misses = 0;
        long scanned = 0;
        String error = null;
        JsonNode resultSet = null;

        reader.stepIn();
        while (reader.next()) {
            if (reader.getType() == IonType.NULL) {
                continue;
            }
            switch (reader.getFieldName()) {
                case "hits" -> hits = reader.readLong();
                case "misses" -> misses = reader.readLong();
                case "scanned" -> scanned = reader.readLong();
                case "error" -> error = reader.readText();
                case "result_set" -> resultSet = IonValueProjector.project(reader);
                default -> {
                    // not part of the envelope
                }
            }
        }
        reader.stepOut();

        if (error != null && !error.isEmpty()) {
            return new StatusEnvelope.Failure(error, FINAL_STATUS);
        }
        return new StatusEnvelope.Success(new QueryStats(hits, misses, scanned), resultSet, columnOrder(resultSet));
    }

    /**
     * Reads {@code query_error::{error}}.
     */
    static StatusEnvelope readQueryError(IonBinaryReader reader) throws MalformedStreamException {
        String error = "";

        reader.stepIn();
        while (reader.next()) {
            if (reader.getType() != IonType.NULL && reader.getFieldName().equals("error")) {
                error = reader.readText();
            }
        }
        reader.stepOut();

        return new StatusEnvelope.Failure(error, QUERY_ERROR);
    }

    private static List<String> columnOrder(JsonNode resultSet) {
        if (resultSet == null || !resultSet.isObject()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(resultSet.size());
        Iterator<String> it = resultSet.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }
}
