/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ironwood.testing.IonPayloadWriter;

import static dev.ironwood.testing.IonPayloadWriter.list;
import static dev.ironwood.testing.IonPayloadWriter.struct;
import static dev.ironwood.testing.IonPayloadWriter.symbol;
import static org.assertj.core.api.Assertions.assertThat;

class IonValueProjectorTest {

    @Test
    void testProjectNestedStruct() throws Exception {
        byte[] payload = new IonPayloadWriter()
                .row("value", struct(
                        "name", "sensor",
                        "tags", list(symbol("a"), symbol("b")),
                        "reading", struct("min", -1, "max", 2.5d, "exact", new BigDecimal("0.10")),
                        "missing", null,
                        "at", Instant.parse("2021-01-30T22:00:00Z")))
                .toByteArray();

        IonBinaryReader reader = new IonBinaryReader(payload);
        reader.next();
        reader.stepIn();
        reader.next();

        JsonNode node = IonValueProjector.project(reader);

        assertThat(node.isObject()).isTrue();
        assertThat(node.get("name").asText()).isEqualTo("sensor");
        assertThat(node.get("tags").isArray()).isTrue();
        assertThat(node.get("tags").get(1).asText()).isEqualTo("b");
        assertThat(node.get("reading").get("min").asLong()).isEqualTo(-1L);
        assertThat(node.get("reading").get("max").asDouble()).isEqualTo(2.5d);
        assertThat(node.get("reading").get("exact").decimalValue()).isEqualTo(new BigDecimal("0.10"));
        assertThat(node.get("missing").isNull()).isTrue();
        assertThat(node.get("at").asText()).isEqualTo("2021-01-30T22:00:00Z");

        // the reader stays on the projected value
        assertThat(reader.getDepth()).isEqualTo(1);
        assertThat(reader.getType()).isEqualTo(IonType.STRUCT);
        assertThat(reader.next()).isFalse();
    }

    @Test
    void testProjectScalarsAndLists() throws Exception {
        BigInteger huge = BigInteger.ONE.shiftLeft(70);
        byte[] payload = new IonPayloadWriter()
                .value(list(1, list(2, list(3)), huge, true, new byte[]{ 7 }))
                .toByteArray();

        IonBinaryReader reader = new IonBinaryReader(payload);
        reader.next();

        JsonNode node = IonValueProjector.project(reader);

        assertThat(node.toString()).isEqualTo("[1,[2,[3]]," + huge + ",true,\"Bw==\"]");
        assertThat(reader.next()).isFalse();
    }

    @Test
    void testDuplicateFieldKeepsLastValue() throws Exception {
        byte[] payload = new IonPayloadWriter()
                .value(struct("k", 1, "k", 2))
                .toByteArray();

        IonBinaryReader reader = new IonBinaryReader(payload);
        reader.next();

        assertThat(IonValueProjector.project(reader).get("k").asInt()).isEqualTo(2);
    }
}
