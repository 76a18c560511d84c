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
 * Signals that the binary Ion payload cannot be decoded: a value is truncated, a type
 * descriptor is unknown, a symbol cannot be resolved or the reader was driven into an
 * illegal state.
 */
public class MalformedStreamException extends IOException {

    public MalformedStreamException(String message) {
        super(message);
    }

    public MalformedStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
