/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.reader;

import java.io.IOException;

import dev.ironwood.internal.ion.IonBinaryReader;

/**
 * Receives the data rows of a result stream. The reader is stepped into the row struct, and
 * fields not consumed by the callback are skipped.
 */
@FunctionalInterface
public interface RowCallback {

    void accept(IonBinaryReader reader, int rowIndex) throws IOException;
}
