/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

import dev.ironwood.internal.ion.IonBinaryReader;
import dev.ironwood.internal.ion.IonType;
import dev.ironwood.metadata.StatusEnvelope;
import dev.ironwood.reader.ProtocolViolationException;

/**
 * Walks the top-level values of a result stream: un-annotated structs are data rows, the
 * annotated struct at the end is the status envelope.
 * <p>
 * Each call to {@link #forEachRow(RowCallback)} reads the payload from the start with a fresh
 * {@link IonBinaryReader}, so the same iterator can drive several passes.
 * </p>
 */
public final class RowIterator {

    private final ByteBuffer payload;

    public RowIterator(ByteBuffer payload) {
        this.payload = payload;
    }

    /**
     * Passes every data row to the callback and returns the terminal status envelope.
     *
     * @throws ProtocolViolationException if a top-level value is not a struct, carries an unknown
     *         annotation, follows the status envelope, or if the envelope is missing
     */
    public StatusEnvelope forEachRow(RowCallback callback) throws IOException {
        IonBinaryReader reader = new IonBinaryReader(payload.duplicate());
        StatusEnvelope status = null;
        String statusAnnotation = null;
        int rowIndex = 0;

        while (reader.next()) {
            if (status != null) {
                throw new ProtocolViolationException("Unexpected data after ::" + statusAnnotation + " annotation");
            }
            if (reader.getType() != IonType.STRUCT) {
                throw new ProtocolViolationException("Expected a struct at the top level, got '" + reader.getType() + "'");
            }

            List<String> annotations = reader.getAnnotations();
            if (annotations.isEmpty()) {
                reader.stepIn();
                callback.accept(reader, rowIndex++);
                reader.stepOut();
                continue;
            }

            statusAnnotation = annotations.get(0);
            status = switch (statusAnnotation) {
                case StatusEnvelopeReader.FINAL_STATUS -> StatusEnvelopeReader.readFinalStatus(reader);
                case StatusEnvelopeReader.QUERY_ERROR -> StatusEnvelopeReader.readQueryError(reader);
                default -> throw new ProtocolViolationException("Unexpected annotation '" + statusAnnotation + "'");
            };
        }

        if (status == null) {
            throw new ProtocolViolationException("Missing final_status annotation (upstream query error)");
        }
        return status;
    }
}
