package com.cymonides.grid.view;

import com.cymonides.grid.model.EdgeDirection;
import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.GridRow;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.PrimaryNode;
import com.cymonides.grid.model.RelatedBucket;
import com.cymonides.grid.model.RowNode;
import com.cymonides.grid.model.TagRef;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects a node and its embedded edges into a grid row.
 * <p>
 * Every edge target lands in the bucket of its class (first edge per target id wins);
 * outgoing {@code tagged_with} edges are also listed as tags. A row without any narrative
 * neighbour is anchored to the project through a placeholder narrative entry.
 */
public class RowMapper {

    static final String PROJECT_TYPE = "project";
    static final String PROJECT_LABEL = "Project";

    private final Clock clock;

    public RowMapper(Clock clock) {
        this.clock = clock;
    }

    public RowMapper() {
        this(Clock.systemUTC());
    }

    public GridRow map(String projectId, GridNode node) {
        Map<String, List<RowNode>> related = new LinkedHashMap<>();
        for (RelatedBucket bucket : RelatedBucket.values()) {
            related.put(bucket.key(), new ArrayList<>());
        }
        List<TagRef> tags = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<EmbeddedEdge> edges = node.getEmbeddedEdges() == null ? List.of() : node.getEmbeddedEdges();
        for (EmbeddedEdge edge : edges) {
            if (EmbeddedEdge.TAGGED_WITH.equals(edge.getRelationship()) && edge.getDirection() == EdgeDirection.OUTGOING) {
                tags.add(new TagRef(edge.getTargetId(), edge.getTargetLabel(), tagColor(edge.getMetadata())));
            }

            String targetId = StringUtils.defaultIfEmpty(edge.getTargetClusterId(), edge.getTargetId());
            if (StringUtils.isEmpty(targetId) || !seen.add(targetId)) {
                continue;
            }
            RowNode neighbour = toRowNode(targetId, edge);
            NodeClass.fromName(edge.getTargetClass()).ifPresent(cls -> {
                switch (cls) {
                    case LOCATION -> {
                        related.get(RelatedBucket.LOCATIONS.key()).add(neighbour);
                        related.get(RelatedBucket.SOURCES.key()).add(neighbour);
                    }
                    case NEXUS -> {
                        related.get(RelatedBucket.NEXUS.key()).add(neighbour);
                        related.get(RelatedBucket.QUERIES.key()).add(neighbour);
                    }
                    case SUBJECT -> {
                        related.get(RelatedBucket.SUBJECTS.key()).add(neighbour);
                        related.get(RelatedBucket.ENTITIES.key()).add(neighbour);
                    }
                    case NARRATIVE -> related.get(RelatedBucket.NARRATIVES.key()).add(neighbour);
                }
            });
        }

        boolean projectNode = node.resolvedClass().filter(c -> c == NodeClass.NARRATIVE).isPresent()
                && PROJECT_TYPE.equals(node.getType());
        List<RowNode> narratives = related.get(RelatedBucket.NARRATIVES.key());
        if (narratives.isEmpty() && StringUtils.isNotEmpty(projectId) && !projectNode) {
            narratives.add(new RowNode(projectId, PROJECT_LABEL, NodeClass.NARRATIVE.canonicalName(),
                    PROJECT_TYPE, Map.of(), Instant.now(clock).toString()));
        }

        String updatedAt = node.metadataUpdatedAt();
        PrimaryNode primary = new PrimaryNode(node.getId(), node.getLabel(), node.getNodeClass(),
                node.getType(), mergedMetadata(node), updatedAt, List.copyOf(tags));
        return new GridRow(primary, related, List.copyOf(tags));
    }

    private static RowNode toRowNode(String targetId, EmbeddedEdge edge) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (edge.getTargetProperties() != null) {
            meta.putAll(edge.getTargetProperties());
        }
        if (edge.getMetadata() != null) {
            meta.putAll(edge.getMetadata());
        }
        meta.put("relationship", edge.getRelationship());
        meta.put("direction", edge.getDirection() == null ? null : edge.getDirection().wireName());
        meta.put("confidence", edge.getConfidence());
        meta.put("verified", edge.getVerified());
        meta.put("cluster_id", edge.getTargetClusterId());
        meta.put("cluster_label", edge.getTargetClusterLabel());
        String label = StringUtils.defaultIfEmpty(edge.getTargetClusterLabel(), edge.getTargetLabel());
        return new RowNode(targetId, label, edge.getTargetClass(), edge.getTargetType(), meta, edge.getTimestamp());
    }

    static Map<String, Object> mergedMetadata(GridNode node) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (node.getMetadata() != null) {
            merged.putAll(node.getMetadata());
        }
        if (node.getProperties() != null) {
            merged.putAll(node.getProperties());
        }
        putIfMissing(merged, "snippet", node.getSnippet());
        putIfMissing(merged, "content", node.getContent());
        putIfMissing(merged, "description", node.getDescription());
        return merged;
    }

    private static void putIfMissing(Map<String, Object> target, String key, String value) {
        if (StringUtils.isNotEmpty(value) && target.get(key) == null) {
            target.put(key, value);
        }
    }

    private static String tagColor(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        Object color = metadata.get("color");
        if (color == null || String.valueOf(color).isEmpty()) {
            color = metadata.get("tagColor");
        }
        return color == null ? null : String.valueOf(color);
    }
}
