/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.compression;

import java.io.IOException;
import java.util.Arrays;
import java.util.zip.Checksum;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Growable output buffer for inflating data of unknown size.
 */
final class InflaterOutput {

    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private byte[] buffer;
    private int size;

    /**
     * @param compressedSize size of the input, used to estimate the output size
     */
    InflaterOutput(int compressedSize) {
        long estimate = Math.max((long) compressedSize * 4, 256);
        this.buffer = new byte[(int) Math.min(estimate, MAX_ARRAY_SIZE)];
    }

    /**
     * Inflate until the inflater reaches the end of its stream.
     */
    void inflateFully(Inflater inflater, String format) throws IOException {
        try {
            while (!inflater.finished()) {
                if (size == buffer.length) {
                    if (size == MAX_ARRAY_SIZE) {
                        throw new IOException("Decompressed " + format + " data exceeds the maximum array size");
                    }
                    buffer = Arrays.copyOf(buffer, (int) Math.min((long) buffer.length * 2, MAX_ARRAY_SIZE));
                }
                int inflated = inflater.inflate(buffer, size, buffer.length - size);
                if (inflated == 0) {
                    if (inflater.finished()) {
                        break;
                    }
                    if (inflater.needsDictionary()) {
                        throw new IOException(format + " stream requires dictionary");
                    }
                    if (inflater.needsInput()) {
                        throw new IOException("Truncated " + format + " data");
                    }
                }
                size += inflated;
            }
        }
        catch (DataFormatException e) {
            throw new IOException(format + " decompression failed", e);
        }
    }

    int size() {
        return size;
    }

    /**
     * Feeds the bytes written since the given offset into a checksum.
     */
    void checksum(Checksum checksum, int from) {
        checksum.update(buffer, from, size - from);
    }

    byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }
}
