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

/**
 * Undoes the content encoding of a buffered response body.
 */
public interface Decompressor {

    /**
     * Decompress the remaining bytes of the given buffer. The size of the decoded body is not
     * known up front.
     *
     * @param compressed the encoded body
     * @return the decoded body
     * @throws IOException if the body is not validly encoded
     */
    byte[] decompress(ByteBuffer compressed) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();
}
