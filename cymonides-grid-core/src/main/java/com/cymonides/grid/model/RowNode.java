package com.cymonides.grid.model;

import java.util.Map;

/** A neighbour shown in one of a row's related buckets. */
public record RowNode(String id,
                      String label,
                      String className,
                      String typeName,
                      Map<String, Object> metadata,
                      String lastSeen) {
}
