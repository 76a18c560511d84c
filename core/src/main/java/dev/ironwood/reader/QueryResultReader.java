/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.util.List;

import dev.ironwood.frame.Field;
import dev.ironwood.frame.Frame;
import dev.ironwood.frame.FrameMeta;
import dev.ironwood.frame.FrameType;
import dev.ironwood.frame.LongToWide;
import dev.ironwood.frame.QueryStat;
import dev.ironwood.frame.TimeSeriesSchema;
import dev.ironwood.frame.Visualization;
import dev.ironwood.internal.compression.Decompressor;
import dev.ironwood.internal.materialize.FieldMaterializer;
import dev.ironwood.internal.reader.RowIterator;
import dev.ironwood.metadata.ContentEncoding;
import dev.ironwood.metadata.StatusEnvelope;
import dev.ironwood.schema.ResultSchema;
import dev.ironwood.schema.SchemaDeriver;

/**
 * Reader for the binary Ion result of one query.
 *
 * <pre>{@code
 * try (QueryResultReader reader = QueryResultReader.open(body, ContentEncoding.fromHeaderValue(encoding))) {
 *     Frame frame = reader.readFrame(FrameOptions.defaults().withRefId("A").withTimeField("time"));
 *     // ...
 * }
 * }</pre>
 * <p>
 * Decoding takes two passes over the decompressed body: the first derives the
 * {@link ResultSchema}, the second materializes the typed fields. The thread's interrupt flag
 * is checked before each pass.
 * </p>
 */
public class QueryResultReader implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(QueryResultReader.class.getName());

    private final RowIterator rows;
    private final IronwoodContext context;
    private final boolean ownsContext;

    private ResultSchema schema;

    private QueryResultReader(ByteBuffer payload, IronwoodContext context, boolean ownsContext) {
        this.rows = new RowIterator(payload);
        this.context = context;
        this.ownsContext = ownsContext;
    }

    /**
     * Open an identity-encoded query result with a dedicated context.
     */
    public static QueryResultReader open(byte[] body) throws IOException {
        return open(body, ContentEncoding.IDENTITY);
    }

    /**
     * Open a query result with a dedicated context.
     * The context is closed when this reader is closed.
     */
    public static QueryResultReader open(byte[] body, ContentEncoding encoding) throws IOException {
        IronwoodContext context = IronwoodContext.create();
        try {
            return open(body, encoding, context, true);
        }
        catch (IOException | RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * Open a query result read fully from the given stream, with a dedicated context.
     * The stream is not closed.
     */
    public static QueryResultReader open(InputStream body, ContentEncoding encoding) throws IOException {
        return open(body.readAllBytes(), encoding);
    }

    /**
     * Open a query result with a shared context.
     * The context is NOT closed when this reader is closed.
     */
    public static QueryResultReader open(byte[] body, ContentEncoding encoding, IronwoodContext context) throws IOException {
        return open(body, encoding, context, false);
    }

    private static QueryResultReader open(byte[] body, ContentEncoding encoding, IronwoodContext context,
                                          boolean ownsContext)
            throws IOException {
        ByteBuffer payload;
        if (encoding == ContentEncoding.IDENTITY) {
            payload = ByteBuffer.wrap(body);
        }
        else {
            Decompressor decompressor = context.decompressorFactory().getDecompressor(encoding);
            payload = ByteBuffer.wrap(decompressor.decompress(ByteBuffer.wrap(body)));
            LOG.log(System.Logger.Level.DEBUG, "Decompressed {0} body: {1} -> {2} bytes",
                    decompressor.getName(), body.length, payload.remaining());
        }
        return new QueryResultReader(payload, context, ownsContext);
    }

    /**
     * Returns the schema of the result, deriving it on first access.
     *
     * @throws ProtocolViolationException if the result does not end with a status envelope
     */
    public ResultSchema getSchema() throws IOException {
        if (schema == null) {
            checkInterrupted();
            LOG.log(System.Logger.Level.DEBUG, "Deriving schema");
            schema = SchemaDeriver.derive(rows);
        }
        return schema;
    }

    /**
     * Decodes the result into a frame.
     *
     * @throws QueryFailedException if the query failed upstream
     * @throws FieldConversionException if a value of the time field cannot be converted
     */
    public Frame readFrame(FrameOptions options) throws IOException {
        ResultSchema resultSchema = getSchema();
        StatusEnvelope status = resultSchema.getStatus();
        if (status instanceof StatusEnvelope.Failure failure) {
            throw new QueryFailedException(failure.message());
        }

        checkInterrupted();
        LOG.log(System.Logger.Level.DEBUG, "Materializing {0} columns of {1} rows{2}",
                resultSchema.getColumnCount(), resultSchema.getRowCount(),
                context.parallelMaterialization() ? " in parallel" : "");
        List<Field> fields = context.parallelMaterialization()
                ? FieldMaterializer.materialize(rows, resultSchema, options.timeField(), context.executor())
                : FieldMaterializer.materialize(rows, resultSchema, options.timeField());

        List<QueryStat> stats = FrameMeta.toQueryStats(((StatusEnvelope.Success) status).stats());
        FrameMeta meta = new FrameMeta(FrameType.TABLE, Visualization.TABLE, options.executedQuery(), stats);
        Frame frame = new Frame(options.refId(), fields, resultSchema.getRowCount(), meta);

        return shape(frame, options);
    }

    private static Frame shape(Frame frame, FrameOptions options) {
        TimeSeriesSchema timeSeries = TimeSeriesSchema.of(frame.getFields());
        FrameMeta meta = frame.getMeta();

        switch (timeSeries.type()) {
            case TIME_SERIES_WIDE:
                return frame.withMeta(meta.withShape(FrameType.TIME_SERIES_WIDE, Visualization.GRAPH));
            case TIME_SERIES_LONG:
                if (options.longToWide()) {
                    try {
                        return LongToWide.convert(frame);
                    }
                    catch (IllegalArgumentException e) {
                        LOG.log(System.Logger.Level.DEBUG, "Keeping long time series frame ''{0}'': {1}",
                                frame.getName(), e.getMessage());
                    }
                }
                return frame.withMeta(meta.withShape(FrameType.TIME_SERIES_LONG, Visualization.TABLE));
            default:
                return frame;
        }
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Decoding of query result interrupted");
        }
    }

    @Override
    public void close() {
        // Only close context if we created it
        if (ownsContext) {
            context.close();
        }
    }
}
