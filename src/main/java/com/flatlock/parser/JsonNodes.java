package com.flatlock.parser;

import java.util.Iterator;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.experimental.UtilityClass;

/**
 * Small accessors over parsed lockfile trees, whose shape is never guaranteed.
 */
@UtilityClass
public class JsonNodes {

    /**
     * @return the scalar text of {@code node.field}, or null when missing, null or not a scalar
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    /**
     * @return {@code node.field} when it is an object, otherwise null
     */
    public static JsonNode object(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? value : null;
    }

    /**
     * Lazy, ordered stream over the fields of an object node. Empty for anything else.
     */
    public static Stream<Map.Entry<String, JsonNode>> fields(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Stream.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(fields, Spliterator.ORDERED), false);
    }
}
