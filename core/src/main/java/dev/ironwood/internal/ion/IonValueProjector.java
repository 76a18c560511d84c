/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.ironwood.internal.ion;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ContainerNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.ironwood.reader.MalformedStreamException;

/**
 * Reads the current value of an {@link IonBinaryReader}, including any nested containers, into
 * a Jackson tree.
 * <p>
 * Structs become objects (a repeated field name keeps its last value), lists and s-expressions
 * become arrays, timestamps become their ISO-8601 text and blobs become binary nodes.
 * Containers are walked with an explicit stack, so deeply nested values cannot exhaust the
 * call stack.
 * </p>
 */
public final class IonValueProjector {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private IonValueProjector() {
    }

    /**
     * Projects the value the reader is positioned on. On return the reader is still positioned
     * on that value, at the same depth.
     */
    public static JsonNode project(IonBinaryReader reader) throws MalformedStreamException {
        IonType type = reader.getType();
        if (type == null) {
            throw new MalformedStreamException("Invalid operation: no current value");
        }
        if (!type.isContainer()) {
            return scalar(reader);
        }

        ContainerNode<?> root = container(type);
        Deque<ContainerNode<?>> open = new ArrayDeque<>();
        open.push(root);
        reader.stepIn();

        while (!open.isEmpty()) {
            if (!reader.next()) {
                reader.stepOut();
                open.pop();
                continue;
            }

            ContainerNode<?> parent = open.peek();
            IonType childType = reader.getType();
            JsonNode child = childType.isContainer() ? container(childType) : scalar(reader);

            if (parent instanceof ObjectNode object) {
                object.set(reader.getFieldName(), child);
            }
            else {
                ((ArrayNode) parent).add(child);
            }

            if (childType.isContainer()) {
                open.push((ContainerNode<?>) child);
                reader.stepIn();
            }
        }
        return root;
    }

    private static ContainerNode<?> container(IonType type) {
        return type == IonType.STRUCT ? NODES.objectNode() : NODES.arrayNode();
    }

    private static JsonNode scalar(IonBinaryReader reader) throws MalformedStreamException {
        return switch (reader.getType()) {
            case NULL -> NODES.nullNode();
            case BOOL -> NODES.booleanNode(reader.readBoolean());
            case INT -> {
                BigInteger value = reader.readBigInteger();
                yield value.bitLength() < 64 ? NODES.numberNode(value.longValue()) : NODES.numberNode(value);
            }
            case FLOAT -> NODES.numberNode(reader.readDouble());
            case DECIMAL -> NODES.numberNode(reader.readDecimal());
            case TIMESTAMP -> NODES.textNode(reader.readTimestamp().toString());
            case SYMBOL, STRING -> NODES.textNode(reader.readText());
            case CLOB, BLOB -> NODES.binaryNode(reader.readBytes());
            default -> throw new MalformedStreamException("Unexpected container type '" + reader.getType() + "'");
        };
    }
}
