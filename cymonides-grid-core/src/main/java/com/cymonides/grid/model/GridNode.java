package com.cymonides.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node document of one project partition together with its embedded edges.
 * {@code nodeClass} holds the normalized class name as read from the store; use
 * {@link #resolvedClass()} to get the enum when the value is one of the known classes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GridNode {
    private String id;
    private String label;
    private String nodeClass;
    private String type;
    private String projectId;
    private Map<String, Object> metadata;
    private Map<String, Object> properties;
    private String snippet;
    private String content;
    private String description;
    private String url;
    private String canonicalValue;
    private String createdAt;
    private String updatedAt;
    @Builder.Default
    private List<EmbeddedEdge> embeddedEdges = new ArrayList<>();

    public Optional<NodeClass> resolvedClass() {
        return NodeClass.fromName(nodeClass);
    }

    /** Recency key used for view ordering and paging. */
    public String metadataUpdatedAt() {
        if (metadata == null) {
            return null;
        }
        Object v = metadata.get("updated_at");
        return v == null ? null : String.valueOf(v);
    }
}
