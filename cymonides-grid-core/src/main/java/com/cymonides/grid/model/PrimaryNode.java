package com.cymonides.grid.model;

import java.util.List;
import java.util.Map;

public record PrimaryNode(String id,
                          String label,
                          String className,
                          String typeName,
                          Map<String, Object> metadata,
                          String updatedAt,
                          List<TagRef> tags) {
}
