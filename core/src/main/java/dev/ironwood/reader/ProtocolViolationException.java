/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import java.io.IOException;

/**
 * Signals a well-formed Ion stream that does not follow the query result protocol, e.g. an
 * unexpected annotation, data following the terminal status envelope or a stream without
 * any terminal status envelope. Usually means the upstream query did not complete.
 */
public class ProtocolViolationException extends IOException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
