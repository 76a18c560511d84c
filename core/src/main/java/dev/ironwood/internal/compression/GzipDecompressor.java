/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.compression;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;
import java.util.zip.Inflater;

/**
 * Decompressor for gzip-encoded bodies (RFC 1952). Concatenated members are decoded one after
 * the other, and each member's CRC32 and size trailer is verified.
 */
public class GzipDecompressor implements Decompressor {

    private static final int ID1 = 0x1f;
    private static final int ID2 = 0x8b;
    private static final int CM_DEFLATE = 8;

    private static final int FHCRC = 1 << 1;
    private static final int FEXTRA = 1 << 2;
    private static final int FNAME = 1 << 3;
    private static final int FCOMMENT = 1 << 4;

    private static final int FIXED_HEADER_SIZE = 10;
    private static final int TRAILER_SIZE = 8;

    @Override
    public byte[] decompress(ByteBuffer compressed) throws IOException {
        ByteBuffer input = compressed.slice().order(ByteOrder.LITTLE_ENDIAN);
        InflaterOutput output = new InflaterOutput(input.remaining());
        CRC32 crc = new CRC32();

        do {
            int memberStart = input.position();
            int dataStart = memberStart + headerLength(input);
            int outputStart = output.size();

            Inflater inflater = new Inflater(true);
            try {
                inflater.setInput(input.slice(dataStart, input.limit() - dataStart));
                output.inflateFully(inflater, "GZIP");
                input.position(input.limit() - inflater.getRemaining());
            }
            finally {
                inflater.end();
            }

            if (input.remaining() < TRAILER_SIZE) {
                throw new IOException("Truncated GZIP trailer");
            }
            crc.reset();
            output.checksum(crc, outputStart);
            int expectedCrc = input.getInt();
            int expectedSize = input.getInt();
            if (expectedCrc != (int) crc.getValue()) {
                throw new IOException("GZIP member at offset " + memberStart + " has a corrupt CRC32");
            }
            if (expectedSize != output.size() - outputStart) {
                throw new IOException("GZIP member at offset " + memberStart + " has a corrupt size");
            }
        } while (input.hasRemaining());

        return output.toByteArray();
    }

    /**
     * Returns the length of the member header at the buffer's position, leaving the position unchanged.
     */
    private static int headerLength(ByteBuffer input) throws IOException {
        int start = input.position();
        int end = input.limit();
        if (end - start < FIXED_HEADER_SIZE) {
            throw new IOException("GZIP data too short for header");
        }
        if ((input.get(start) & 0xff) != ID1 || (input.get(start + 1) & 0xff) != ID2) {
            throw new IOException("Not in GZIP format");
        }
        int method = input.get(start + 2) & 0xff;
        if (method != CM_DEFLATE) {
            throw new IOException("Unsupported GZIP compression method: " + method);
        }

        int flags = input.get(start + 3) & 0xff;
        int offset = start + FIXED_HEADER_SIZE;
        if ((flags & FEXTRA) != 0) {
            if (offset + 2 > end) {
                throw new IOException("Truncated GZIP extra field");
            }
            offset += 2 + (input.getShort(offset) & 0xffff);
        }
        if ((flags & FNAME) != 0) {
            offset = afterTerminator(input, offset, "file name");
        }
        if ((flags & FCOMMENT) != 0) {
            offset = afterTerminator(input, offset, "comment");
        }
        if ((flags & FHCRC) != 0) {
            offset += 2;
        }
        if (offset >= end) {
            throw new IOException("GZIP header extends beyond data");
        }
        return offset - start;
    }

    private static int afterTerminator(ByteBuffer input, int offset, String what) throws IOException {
        for (int i = offset; i < input.limit(); i++) {
            if (input.get(i) == 0) {
                return i + 1;
            }
        }
        throw new IOException("Unterminated GZIP " + what);
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
