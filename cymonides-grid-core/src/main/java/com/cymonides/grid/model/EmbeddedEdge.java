package com.cymonides.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One side of a relationship, stored inside the node document it belongs to.
 * Both sides of a relationship share the same {@code edgeId}; the target snapshot
 * fields are copied from the other node when the edge is written and are not refreshed
 * afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddedEdge {

    /** Relationship from a tagged node to its tag node. */
    public static final String TAGGED_WITH = "tagged_with";
    /** Relationship from a watcher node to a watched node. */
    public static final String MONITORS = "monitors";

    private String edgeId;
    private String targetId;
    private String targetLabel;
    private String targetClass;
    private String targetType;
    private Map<String, Object> targetProperties;
    private String targetClusterId;
    private String targetClusterLabel;
    private String relationship;
    private EdgeDirection direction;
    private Double confidence;
    private Boolean verified;
    private String sourceUrl;
    private String timestamp;
    private Map<String, Object> metadata;
    private String createdAt;

    public boolean sameSlot(EmbeddedEdge other) {
        return other != null
                && edgeId != null
                && edgeId.equals(other.edgeId)
                && direction == other.direction;
    }
}
