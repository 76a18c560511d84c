/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.reader;

import dev.ironwood.internal.ion.IonType;

/**
 * Thrown when a typed read is attempted on a value of a different type.
 */
public class TypeMismatchException extends MalformedStreamException {

    private final String expected;
    private final IonType actual;
    private final String fieldName;

    public TypeMismatchException(String expected, IonType actual, String fieldName) {
        super(message(expected, actual, fieldName));
        this.expected = expected;
        this.actual = actual;
        this.fieldName = fieldName;
    }

    private static String message(String expected, IonType actual, String fieldName) {
        String message = "Expected '" + expected + "' type, got '" + (actual != null ? actual.label() : "none") + "'";
        if (fieldName != null) {
            message += " for field '" + fieldName + "'";
        }
        return message;
    }

    public String getExpected() {
        return expected;
    }

    public IonType getActual() {
        return actual;
    }

    /**
     * Name of the struct field holding the offending value, or null outside of structs.
     */
    public String getFieldName() {
        return fieldName;
    }
}
