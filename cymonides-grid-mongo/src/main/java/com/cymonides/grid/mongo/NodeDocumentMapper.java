package com.cymonides.grid.mongo;

import com.cymonides.grid.model.EdgeDirection;
import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import org.apache.commons.lang3.StringUtils;
import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between node documents and {@link GridNode}. Reading is lenient: class and
 * type are taken from whichever of the legacy spellings is present, and malformed
 * embedded edge entries are skipped.
 */
public final class NodeDocumentMapper {

    public static final String ID = "_id";
    public static final String NODE_ID = "id";
    public static final String LABEL = "label";
    public static final String NODE_CLASS = "node_class";
    public static final String LEGACY_CLASS = "class";
    public static final String CLASS_NAME = "className";
    public static final String TYPE = "type";
    public static final String TYPE_NAME = "typeName";
    public static final String METADATA = "metadata";
    public static final String PROPERTIES = "properties";
    public static final String EMBEDDED_EDGES = "embedded_edges";
    public static final String UPDATED_AT_PATH = "metadata.updated_at";

    public static final String EDGE_ID = "edge_id";
    public static final String TARGET_ID = "target_id";
    public static final String DIRECTION = "direction";

    private NodeDocumentMapper() {
    }

    public static Document toDocument(GridNode node) {
        String nodeClass = NodeClass.normalize(node.getNodeClass());
        Document doc = new Document(ID, node.getId())
                .append(NODE_ID, node.getId())
                .append(LABEL, node.getLabel())
                .append(NODE_CLASS, nodeClass)
                .append(LEGACY_CLASS, NodeClass.legacy(nodeClass))
                .append(CLASS_NAME, nodeClass)
                .append(TYPE, node.getType())
                .append(TYPE_NAME, node.getType())
                .append(METADATA, node.getMetadata() == null ? new Document() : new Document(node.getMetadata()))
                .append("content", StringUtils.defaultString(node.getContent()))
                .append("snippet", StringUtils.defaultString(node.getSnippet()))
                .append("createdAt", node.getCreatedAt())
                .append("updatedAt", node.getUpdatedAt())
                .append("timestamp", node.getUpdatedAt())
                .append("projectId", node.getProjectId())
                .append("canonicalValue", node.getCanonicalValue())
                .append("url", node.getUrl());
        if (node.getProperties() != null) {
            doc.append(PROPERTIES, new Document(node.getProperties()));
        }
        if (node.getDescription() != null) {
            doc.append("description", node.getDescription());
        }
        List<Document> edges = new ArrayList<>();
        if (node.getEmbeddedEdges() != null) {
            for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                edges.add(toDocument(edge));
            }
        }
        doc.append(EMBEDDED_EDGES, edges);
        return doc;
    }

    public static Document toDocument(EmbeddedEdge edge) {
        return new Document(EDGE_ID, edge.getEdgeId())
                .append(TARGET_ID, edge.getTargetId())
                .append("target_label", edge.getTargetLabel())
                .append("target_class", edge.getTargetClass())
                .append("target_type", edge.getTargetType())
                .append("target_cluster_id", edge.getTargetClusterId())
                .append("target_cluster_label", edge.getTargetClusterLabel())
                .append("relationship", edge.getRelationship())
                .append(DIRECTION, edge.getDirection() == null ? null : edge.getDirection().wireName())
                .append("confidence", edge.getConfidence())
                .append("verified", edge.getVerified())
                .append("source_url", edge.getSourceUrl())
                .append("timestamp", edge.getTimestamp())
                .append("target_properties", edge.getTargetProperties() == null
                        ? new Document() : new Document(edge.getTargetProperties()))
                .append(METADATA, edge.getMetadata() == null ? new Document() : new Document(edge.getMetadata()))
                .append("created_at", edge.getCreatedAt());
    }

    public static GridNode toNode(Document doc) {
        String id = firstString(doc, NODE_ID, ID);
        String nodeClass = NodeClass.normalize(firstString(doc, NODE_CLASS, CLASS_NAME, LEGACY_CLASS));
        String type = firstString(doc, TYPE, TYPE_NAME);

        List<EmbeddedEdge> edges = new ArrayList<>();
        if (doc.get(EMBEDDED_EDGES) instanceof List<?> raw) {
            for (Object entry : raw) {
                if (entry instanceof Map<?, ?> m) {
                    edges.add(toEdge(m));
                }
            }
        }

        return GridNode.builder()
                .id(id)
                .label(stringOf(doc.get(LABEL)))
                .nodeClass(nodeClass)
                .type(type)
                .projectId(stringOf(doc.get("projectId")))
                .metadata(mapOf(doc.get(METADATA)))
                .properties(doc.containsKey(PROPERTIES) ? mapOf(doc.get(PROPERTIES)) : null)
                .snippet(stringOf(doc.get("snippet")))
                .content(stringOf(doc.get("content")))
                .description(stringOf(doc.get("description")))
                .url(stringOf(doc.get("url")))
                .canonicalValue(stringOf(doc.get("canonicalValue")))
                .createdAt(stringOf(doc.get("createdAt")))
                .updatedAt(stringOf(doc.get("updatedAt")))
                .embeddedEdges(edges)
                .build();
    }

    static EmbeddedEdge toEdge(Map<?, ?> m) {
        return EmbeddedEdge.builder()
                .edgeId(stringOf(m.get(EDGE_ID)))
                .targetId(stringOf(m.get(TARGET_ID)))
                .targetLabel(stringOf(m.get("target_label")))
                .targetClass(stringOf(m.get("target_class")))
                .targetType(stringOf(m.get("target_type")))
                .targetProperties(mapOf(m.get("target_properties")))
                .targetClusterId(stringOf(m.get("target_cluster_id")))
                .targetClusterLabel(stringOf(m.get("target_cluster_label")))
                .relationship(stringOf(m.get("relationship")))
                .direction(EdgeDirection.fromWire(stringOf(m.get(DIRECTION))))
                .confidence(m.get("confidence") instanceof Number n ? n.doubleValue() : null)
                .verified(m.get("verified") instanceof Boolean b ? b : null)
                .sourceUrl(stringOf(m.get("source_url")))
                .timestamp(stringOf(m.get("timestamp")))
                .metadata(mapOf(m.get(METADATA)))
                .createdAt(stringOf(m.get("created_at")))
                .build();
    }

    private static String firstString(Document doc, String... keys) {
        for (String key : keys) {
            String v = stringOf(doc.get(key));
            if (StringUtils.isNotEmpty(v)) {
                return v;
            }
        }
        return null;
    }

    private static String stringOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> mapOf(Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> m) {
            m.forEach((k, v) -> out.put(String.valueOf(k), v));
        }
        return out;
    }
}
