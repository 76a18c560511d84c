/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;

import dev.ironwood.frame.Field;
import dev.ironwood.frame.FieldType;
import dev.ironwood.frame.Frame;
import dev.ironwood.frame.FrameType;
import dev.ironwood.frame.QueryStat;
import dev.ironwood.frame.Visualization;
import dev.ironwood.metadata.ContentEncoding;
import dev.ironwood.schema.ColumnType;
import dev.ironwood.schema.ResultSchema;
import dev.ironwood.testing.IonPayloadWriter;

import static dev.ironwood.testing.IonPayloadWriter.struct;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryResultReaderTest {

    private static final BigInteger UNSIGNED_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    @Test
    void testAllRowsPresent() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .row("x", 2)
                .row("x", 3)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults().withRefId("A"));

            assertThat(frame.getName()).isEqualTo("A");
            assertThat(frame.getRowCount()).isEqualTo(3);
            Field.LongField x = (Field.LongField) frame.getField("x");
            assertThat(x.type()).isEqualTo(FieldType.UINT64);
            assertThat(x.values()).containsExactly(1L, 2L, 3L);
            assertThat(x.nulls().isEmpty()).isTrue();
            assertThat(x.missing().isEmpty()).isTrue();
            assertThat(frame.getMeta().type()).isEqualTo(FrameType.TABLE);
        }
    }

    @Test
    void testOptionalColumns() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .row("y", 2)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            ResultSchema schema = reader.getSchema();
            assertThat(schema.getColumn("x").optional()).isTrue();
            assertThat(schema.getColumn("y").optional()).isTrue();

            Frame frame = reader.readFrame(FrameOptions.defaults());
            Field x = frame.getField("x");
            Field y = frame.getField("y");
            assertThat(x.type()).isEqualTo(FieldType.NULLABLE_UINT64);
            assertThat(x.getValue(0)).isEqualTo(1L);
            assertThat(x.isMissing(1)).isTrue();
            assertThat(y.isMissing(0)).isTrue();
            assertThat(y.getValue(1)).isEqualTo(2L);
        }
    }

    @Test
    void testStatisticsAndExecutedQuery() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .finalStatus(10, 0, 1024, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            assertThat(reader.getSchema().getStatus().isFailure()).isFalse();

            Frame frame = reader.readFrame(FrameOptions.defaults().withExecutedQuery("SELECT x FROM t"));
            assertThat(frame.getMeta().executedQuery()).isEqualTo("SELECT x FROM t");
            assertThat(frame.getMeta().stats()).containsExactly(
                    new QueryStat("Hits", null, 10),
                    new QueryStat("Misses", null, 0),
                    new QueryStat("Scanned", "bytes", 1024));
        }
    }

    @Test
    void testFailedQuery() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .finalStatus(0, 0, 0, "table not found")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            assertThat(reader.getSchema().getStatus().isFailure()).isTrue();
            assertThatThrownBy(() -> reader.readFrame(FrameOptions.defaults()))
                    .isInstanceOf(QueryFailedException.class)
                    .hasMessage("query execution failed: 'table not found'")
                    .satisfies(e -> assertThat(((QueryFailedException) e).getUpstreamMessage())
                            .isEqualTo("table not found"));
        }
    }

    @Test
    void testQueryErrorEnvelope() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .queryError("out of memory")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            assertThatThrownBy(() -> reader.readFrame(FrameOptions.defaults()))
                    .isInstanceOf(QueryFailedException.class)
                    .hasMessageContaining("out of memory");
        }
    }

    @Test
    void testMissingFinalStatus() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("x", 1)
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            assertThatThrownBy(reader::getSchema)
                    .isInstanceOf(ProtocolViolationException.class)
                    .hasMessageContaining("Missing final_status");
        }
    }

    @Test
    void testResultSetOrdersColumns() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("b", "x", "a", 1, "extra", true)
                .row("a", 2, "b", "y")
                .finalStatus(0, 0, 0, "", struct("a", 0, "b", ""))
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults());
            assertThat(frame.getFields()).extracting(Field::name).containsExactly("a", "b", "extra");
        }
    }

    @Test
    void testTextTimeFieldMakesWideTimeSeries() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("time", "2021-01-30T22:00:00Z", "value", 1.5d)
                .row("time", "2021-01-30T22:01:00Z", "value", 2.5d)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults().withTimeField("time"));

            Field.TimeField time = (Field.TimeField) frame.getField("time");
            assertThat(time.get(0)).isEqualTo(Instant.parse("2021-01-30T22:00:00Z"));
            assertThat(frame.getMeta().type()).isEqualTo(FrameType.TIME_SERIES_WIDE);
            assertThat(frame.getMeta().preferredVisualization()).isEqualTo(Visualization.GRAPH);
        }
    }

    @Test
    void testInvalidTimeFieldValueFailsDecode() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("time", "2021-01-30T22:00:00Z", "value", 1)
                .row("time", "30/01/2021", "value", 2)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            assertThatThrownBy(() -> reader.readFrame(FrameOptions.defaults().withTimeField("time")))
                    .isInstanceOf(FieldConversionException.class)
                    .hasMessageContaining("'time'")
                    .hasMessageContaining("row 1");
        }
    }

    @Test
    void testLongTimeSeriesIsPivoted() throws Exception {
        Instant t0 = Instant.parse("2022-05-01T00:00:00Z");
        Instant t1 = Instant.parse("2022-05-01T00:01:00Z");
        byte[] body = new IonPayloadWriter()
                .row("time", t0, "host", "a", "cpu", 1.0d)
                .row("time", t0, "host", "b", "cpu", 2.0d)
                .row("time", t1, "host", "a", "cpu", 3.0d)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults());

            assertThat(frame.getMeta().type()).isEqualTo(FrameType.TIME_SERIES_WIDE);
            assertThat(frame.getRowCount()).isEqualTo(2);
            assertThat(frame.getFieldCount()).isEqualTo(3);
            assertThat(frame.getField(1).labels()).isEqualTo(Map.of("host", "a"));
            assertThat(frame.getField(1).getValue(0)).isEqualTo(1.0d);
            assertThat(frame.getField(1).getValue(1)).isEqualTo(3.0d);
            assertThat(frame.getField(2).labels()).isEqualTo(Map.of("host", "b"));
            assertThat(frame.getField(2).getValue(0)).isEqualTo(2.0d);
            assertThat(frame.getField(2).isNull(1)).isTrue();
        }
    }

    @Test
    void testLongTimeSeriesKeptWhenDisabledOrUnsorted() throws Exception {
        Instant t0 = Instant.parse("2022-05-01T00:00:00Z");
        Instant t1 = Instant.parse("2022-05-01T00:01:00Z");
        byte[] sorted = new IonPayloadWriter()
                .row("time", t0, "host", "a", "cpu", 1)
                .row("time", t1, "host", "a", "cpu", 2)
                .finalStatus(0, 0, 0, "")
                .toByteArray();
        byte[] unsorted = new IonPayloadWriter()
                .row("time", t1, "host", "a", "cpu", 1)
                .row("time", t0, "host", "a", "cpu", 2)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(sorted)) {
            Frame frame = reader.readFrame(FrameOptions.defaults().withLongToWide(false));
            assertThat(frame.getMeta().type()).isEqualTo(FrameType.TIME_SERIES_LONG);
            assertThat(frame.getMeta().preferredVisualization()).isEqualTo(Visualization.TABLE);
            assertThat(frame.getRowCount()).isEqualTo(2);
        }
        try (QueryResultReader reader = QueryResultReader.open(unsorted)) {
            Frame frame = reader.readFrame(FrameOptions.defaults());
            assertThat(frame.getMeta().type()).isEqualTo(FrameType.TIME_SERIES_LONG);
            assertThat(frame.getFieldCount()).isEqualTo(3);
        }
    }

    @Test
    void testReadFrameTwice() throws Exception {
        IonPayloadWriter writer = new IonPayloadWriter();
        for (int i = 0; i < 30; i++) {
            writer.row("s", i % 7 == 1 ? null : "v" + i, "n", i - 15, "u", UNSIGNED_MAX.subtract(BigInteger.valueOf(i)));
        }
        byte[] body = writer.finalStatus(1, 2, 3, "").toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame first = reader.readFrame(FrameOptions.defaults());
            Frame second = reader.readFrame(FrameOptions.defaults());

            assertThat(second.getRowCount()).isEqualTo(30);
            assertThat(second.getFields()).isEqualTo(first.getFields());
            assertThat(second.getMeta()).isEqualTo(first.getMeta());
            assertThat(second.getField("n").type()).isEqualTo(FieldType.INT64);
            assertThat(second.getField("s").isNull(1)).isTrue();
            assertThat(second.getField("u").getValue(29)).isEqualTo(UNSIGNED_MAX.subtract(BigInteger.valueOf(29)));
        }
    }

    @Test
    void testUnsignedValuesAboveLongRange() throws Exception {
        byte[] body = new IonPayloadWriter()
                .row("u", UNSIGNED_MAX)
                .row("u", 7)
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults());

            Field.LongField u = (Field.LongField) frame.getField("u");
            assertThat(u.type()).isEqualTo(FieldType.UINT64);
            assertThat(u.get(0)).isEqualTo(-1L);
            assertThat(u.getValue(0)).isEqualTo(new BigInteger("18446744073709551615"));
            assertThat(u.getValue(1)).isEqualTo(7L);
            assertThat(frame.toString()).contains("| 18446744073709551615 |");
        }
    }

    @Test
    void testFrameIsNotChangedThroughFieldAccessors() throws Exception {
        try (QueryResultReader reader = QueryResultReader.open(sampleBody())) {
            Frame frame = reader.readFrame(FrameOptions.defaults());
            Field.LongField count = (Field.LongField) frame.getField("count");
            long before = count.get(0);

            count.values()[0] = 99;
            count.missing().set(1);
            count.nulls().set(1);

            assertThat(count.get(0)).isEqualTo(before);
            assertThat(count.isMissing(1)).isFalse();
            assertThat(count.isNull(1)).isFalse();
            assertThat(frame.getField("count")).isEqualTo(count);
        }
    }

    @Test
    void testEmptyResult() throws Exception {
        byte[] body = new IonPayloadWriter()
                .finalStatus(0, 0, 0, "")
                .toByteArray();

        try (QueryResultReader reader = QueryResultReader.open(body)) {
            Frame frame = reader.readFrame(FrameOptions.defaults());
            assertThat(frame.getRowCount()).isZero();
            assertThat(frame.getFields()).isEmpty();
        }
    }

    @Test
    void testSharedContextWithParallelMaterialization() throws Exception {
        IonPayloadWriter writer = new IonPayloadWriter();
        for (int i = 0; i < 50; i++) {
            writer.row("i", i, "label", "row-" + i, "flag", i % 2 == 0);
        }
        byte[] body = writer.finalStatus(0, 0, 0, "").toByteArray();

        try (IronwoodContext context = IronwoodContext.create(2, true)) {
            try (QueryResultReader reader = QueryResultReader.open(body, ContentEncoding.IDENTITY, context)) {
                Frame frame = reader.readFrame(FrameOptions.defaults());
                assertThat(frame.getField("i").getValue(49)).isEqualTo(49L);
                assertThat(frame.getField("label").getValue(7)).isEqualTo("row-7");
                assertThat(frame.getField("flag").getValue(3)).isEqualTo(false);
            }
            // The shared context survives the reader
            assertThat(context.executor().isShutdown()).isFalse();
        }
    }

    @Test
    void testGzipBody() throws Exception {
        byte[] body = sampleBody();
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(compressed)) {
            out.write(body);
        }

        assertSample(QueryResultReader.open(new ByteArrayInputStream(compressed.toByteArray()), ContentEncoding.GZIP));
    }

    @Test
    void testCorruptCompressedBody() {
        assertThatThrownBy(() -> QueryResultReader.open(new byte[]{ 1, 2, 3, 4 }, ContentEncoding.GZIP))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testInterruptedBeforeDecoding() throws Exception {
        try (QueryResultReader reader = QueryResultReader.open(sampleBody())) {
            Thread.currentThread().interrupt();
            try {
                assertThatThrownBy(() -> reader.readFrame(FrameOptions.defaults()))
                        .isInstanceOf(InterruptedIOException.class);
            }
            finally {
                Thread.interrupted();
            }
        }
    }

    private static byte[] sampleBody() {
        return new IonPayloadWriter()
                .row("name", "alpha", "count", 3)
                .row("name", "beta", "count", 5)
                .finalStatus(2, 1, 512, "")
                .toByteArray();
    }

    private static void assertSample(QueryResultReader reader) throws IOException {
        try (reader) {
            ResultSchema schema = reader.getSchema();
            assertThat(schema.getColumn("name").type()).isEqualTo(ColumnType.TEXT);

            Frame frame = reader.readFrame(FrameOptions.defaults());
            assertThat(frame.getField("name").getValue(1)).isEqualTo("beta");
            assertThat(frame.getField("count").getValue(0)).isEqualTo(3L);
            assertThat(frame.getMeta().stats()).extracting(QueryStat::value).containsExactly(2L, 1L, 512L);
        }
    }
}
