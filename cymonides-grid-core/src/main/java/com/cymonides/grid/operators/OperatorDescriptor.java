package com.cymonides.grid.operators;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the operator registry. {@code attributes} holds every field of the source
 * entry, including the four promoted ones.
 */
public record OperatorDescriptor(String id,
                                 String category,
                                 String status,
                                 String description,
                                 Map<String, Object> attributes) {

    public OperatorDescriptor {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static OperatorDescriptor fromMap(Map<String, Object> entry) {
        return new OperatorDescriptor(
                asString(entry.get("id")),
                asString(entry.get("category")),
                asString(entry.get("status")),
                asString(entry.get("description")),
                entry);
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
