/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.compression;

import java.nio.ByteBuffer;

/**
 * Decompressor for identity-encoded bodies.
 */
public class UncompressedDecompressor implements Decompressor {

    @Override
    public byte[] decompress(ByteBuffer compressed) {
        byte[] data = new byte[compressed.remaining()];
        compressed.duplicate().get(data);
        return data;
    }

    @Override
    public String getName() {
        return "IDENTITY";
    }
}
