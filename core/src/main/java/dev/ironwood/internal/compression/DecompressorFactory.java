/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.compression;

import dev.ironwood.metadata.ContentEncoding;

/**
 * Factory for creating {@link Decompressor} instances based on the content encoding.
 */
public class DecompressorFactory {

    /**
     * Get a decompressor for the given content encoding.
     */
    public Decompressor getDecompressor(ContentEncoding encoding) {
        return switch (encoding) {
            case IDENTITY -> new UncompressedDecompressor();
            case GZIP -> new GzipDecompressor();
        };
    }
}
