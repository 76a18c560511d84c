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
 * A value of the designated time field could not be converted into an instant.
 */
public class FieldConversionException extends IOException {

    private final String fieldName;
    private final int rowIndex;

    public FieldConversionException(String fieldName, int rowIndex, String message, Throwable cause) {
        super("Cannot convert value of time field '" + fieldName + "' in row " + rowIndex + ": " + message, cause);
        this.fieldName = fieldName;
        this.rowIndex = rowIndex;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
