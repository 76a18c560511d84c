/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

import java.util.Arrays;

/**
 * Cursor state for one nesting level of an {@link IonBinaryReader}: the byte window of the
 * container and the header of its current value. Instances are pooled by depth and reused.
 */
final class ContainerFrame {

    /** Offset of the next value (or field name) to read. */
    int position;

    /** End of this container's window, exclusive. */
    int limit;

    boolean struct;

    IonType type;
    int typeCode;
    int lengthNibble;
    int bodyStart;
    int bodyLength;

    /** Symbol id of the current field name, -1 outside of structs. */
    long fieldSid = -1;

    long[] annotations = new long[2];
    int annotationCount;

    void enter(int start, int limit, boolean struct) {
        this.position = start;
        this.limit = limit;
        this.struct = struct;
        clearValue();
    }

    void clearValue() {
        type = null;
        typeCode = -1;
        lengthNibble = -1;
        bodyStart = position;
        bodyLength = 0;
        fieldSid = -1;
        annotationCount = 0;
    }

    void addAnnotation(long sid) {
        if (annotationCount == annotations.length) {
            annotations = Arrays.copyOf(annotations, annotations.length * 2);
        }
        annotations[annotationCount++] = sid;
    }
}
