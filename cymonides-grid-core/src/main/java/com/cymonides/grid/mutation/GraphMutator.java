package com.cymonides.grid.mutation;

import com.cymonides.grid.model.EdgeDirection;
import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.TagResult;
import com.cymonides.grid.model.WatcherResult;
import com.cymonides.grid.store.GridStoreException;
import com.cymonides.grid.store.NodeStore;
import com.cymonides.grid.util.GridIds;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Creates and removes bidirectional embedded edges and the tag and watcher nodes that
 * hang off them.
 * <p>
 * A relationship is written as two single-document updates: the outgoing entry on the
 * source, then the incoming entry on the target. Both carry the same deterministic edge
 * id, so repeating a call never duplicates an entry and removing is a no-op once the
 * entries are gone. There is no cross-document transaction: the second write is retried
 * and, when it still fails, the first one is undone before the error propagates.
 * Relationships whose source or target no longer exists are skipped.
 */
public class GraphMutator {

    private static final Logger LOG = Logger.getLogger(GraphMutator.class);

    static final String SOURCE = "grid_b";
    static final int WATCHER_ID_ATTEMPTS = 8;

    private final NodeStore store;
    private final Clock clock;
    private final int pairWriteAttempts;

    public GraphMutator(NodeStore store, Clock clock, int pairWriteAttempts) {
        this.store = store;
        this.clock = clock;
        this.pairWriteAttempts = Math.max(1, pairWriteAttempts);
    }

    public GraphMutator(NodeStore store) {
        this(store, Clock.systemUTC(), 2);
    }

    public TagResult applyTag(String projectId, List<String> nodeIds, String label) {
        requireProject(projectId);
        if (nodeIds == null || nodeIds.isEmpty()) {
            return new TagResult(null, label, 0);
        }
        String tagId = GridIds.tagId(label);
        GridNode tag = ensureTagNode(projectId, tagId, label);
        Object color = tag.getMetadata() == null ? null : tag.getMetadata().get("tagColor");

        int count = 0;
        for (String nodeId : nodeIds) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("tagLabel", label);
            meta.put("tagColor", color);
            meta.put("color", color);
            meta.put("tagged_at", now());
            meta.put("source", SOURCE);
            if (createEdgePair(projectId, nodeId, tagId, EmbeddedEdge.TAGGED_WITH, meta)) {
                count++;
            }
        }
        LOG.infof("Applied tag %s to %d of %d nodes in project %s", tagId, count, nodeIds.size(), projectId);
        return new TagResult(tagId, label, count);
    }

    /**
     * Detaches the tag from the given nodes. The tag node itself is kept even when no
     * member is left.
     */
    public TagResult removeTag(String projectId, List<String> nodeIds, String label) {
        requireProject(projectId);
        if (nodeIds == null || nodeIds.isEmpty()) {
            return new TagResult(null, label, 0);
        }
        String tagId = GridIds.tagId(label);
        int count = 0;
        for (String nodeId : nodeIds) {
            if (removeEdgePair(projectId, nodeId, tagId, EmbeddedEdge.TAGGED_WITH)) {
                count++;
            }
        }
        LOG.infof("Removed tag %s from %d of %d nodes in project %s", tagId, count, nodeIds.size(), projectId);
        return new TagResult(tagId, label, count);
    }

    public WatcherResult createWatcher(String projectId, String label, List<String> nodeIds, String typeHint) {
        requireProject(projectId);
        List<String> targets = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        String createdAt = now();

        Map<String, Object> et3 = new LinkedHashMap<>();
        et3.put("watcherType", "entity");
        et3.put("monitoredTypes", typeHint == null ? null : List.of(typeHint));
        et3.put("alertOnAnyMatch", true);

        Map<String, Object> narrative = new LinkedHashMap<>();
        narrative.put("parentDocumentId", "");
        narrative.put("headerLevel", 0);
        narrative.put("headerIndex", 0);
        narrative.put("watcherStatus", "active");
        narrative.put("extractionCount", 0);
        narrative.put("lastCheckedAt", null);
        narrative.put("findings", new ArrayList<>());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("projectId", projectId);
        metadata.put("createdBy", 0);
        metadata.put("et3", et3);
        metadata.put("narrative", narrative);
        metadata.put("created_at", createdAt);
        metadata.put("updated_at", createdAt);

        String snippet = "Entity watcher: " + (typeHint == null ? "all" : typeHint);
        GridNode watcher = null;
        for (int attempt = 0; watcher == null; attempt++) {
            if (attempt == WATCHER_ID_ATTEMPTS) {
                throw new GridStoreException(projectId, "No free watcher id for '" + label + "' at " + createdAt, null);
            }
            // same label at the same instant: salt the id until an unused one is found
            String seed = attempt == 0 ? createdAt : createdAt + "#" + attempt;
            GridNode candidate = newNarrativeNode(projectId, GridIds.watcherId(label, seed), "watcher", label,
                    metadata, snippet, createdAt);
            if (store.insertNew(projectId, candidate)) {
                watcher = candidate;
            } else {
                LOG.debugf("Watcher id %s is taken in project %s", candidate.getId(), projectId);
            }
        }
        String watcherId = watcher.getId();

        for (String nodeId : targets) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("source", SOURCE);
            meta.put("matchedAt", now());
            createEdgePair(projectId, watcherId, nodeId, EmbeddedEdge.MONITORS, meta);
        }
        LOG.infof("Created watcher %s '%s' over %d nodes in project %s", watcherId, label, targets.size(), projectId);
        return new WatcherResult(watcherId, label, targets.size(), targets, watcher.getMetadata());
    }

    /**
     * Writes both sides of {@code fromId -[relation]-> toId}.
     *
     * @return false when either endpoint does not exist and nothing was written
     */
    public boolean createEdgePair(String projectId, String fromId, String toId, String relation,
                                  Map<String, Object> metadata) {
        Map<String, GridNode> endpoints = new LinkedHashMap<>();
        for (GridNode n : store.findByIds(projectId, List.of(fromId, toId))) {
            endpoints.put(n.getId(), n);
        }
        GridNode source = endpoints.get(fromId);
        GridNode target = endpoints.get(toId);
        if (source == null || target == null) {
            LOG.debugf("Skipping %s edge %s -> %s in project %s: endpoint not found", relation, fromId, toId, projectId);
            return false;
        }

        String edgeId = GridIds.edgeId(fromId, toId, relation);
        String now = now();
        Map<String, Object> meta = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        EmbeddedEdge outgoing = snapshot(edgeId, target, relation, EdgeDirection.OUTGOING, meta, now);
        EmbeddedEdge incoming = snapshot(edgeId, source, relation, EdgeDirection.INCOMING, meta, now);

        boolean appended = store.appendEdge(projectId, fromId, outgoing);
        try {
            withRetry(() -> store.appendEdge(projectId, toId, incoming));
        } catch (GridStoreException e) {
            if (appended) {
                LOG.warnf("Incoming side of edge %s on %s failed, undoing outgoing side on %s", edgeId, toId, fromId);
                compensate(e, () -> store.removeEdge(projectId, fromId, edgeId));
            }
            throw e;
        }
        return true;
    }

    /**
     * Removes both sides of {@code fromId -[relation]-> toId} by edge id.
     *
     * @return true when at least one side held the edge
     */
    public boolean removeEdgePair(String projectId, String fromId, String toId, String relation) {
        String edgeId = GridIds.edgeId(fromId, toId, relation);
        List<EmbeddedEdge> removed = store.removeEdge(projectId, fromId, edgeId);
        List<EmbeddedEdge> removedTarget;
        try {
            removedTarget = withRetry(() -> store.removeEdge(projectId, toId, edgeId));
        } catch (GridStoreException e) {
            if (!removed.isEmpty()) {
                LOG.warnf("Removing edge %s from %s failed, restoring it on %s", edgeId, toId, fromId);
                compensate(e, () -> {
                    removed.forEach(edge -> store.appendEdge(projectId, fromId, edge));
                    return null;
                });
            }
            throw e;
        }
        return !removed.isEmpty() || !removedTarget.isEmpty();
    }

    private GridNode ensureTagNode(String projectId, String tagId, String label) {
        String createdAt = now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_id", projectId);
        metadata.put("created_at", createdAt);
        metadata.put("updated_at", createdAt);
        metadata.put("tag_type", "grid_filter");
        metadata.put("source", SOURCE);
        GridNode tag = newNarrativeNode(projectId, tagId, "tag", label, metadata, "", createdAt);
        return store.insertIfAbsent(projectId, tag);
    }

    private static GridNode newNarrativeNode(String projectId, String id, String type, String label,
                                             Map<String, Object> metadata, String snippet, String now) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("project_id", projectId);
        meta.putIfAbsent("created_at", now);
        meta.putIfAbsent("updated_at", now);
        return GridNode.builder()
                .id(id)
                .label(label)
                .nodeClass(NodeClass.NARRATIVE.canonicalName())
                .type(type)
                .projectId(projectId)
                .metadata(meta)
                .content("")
                .snippet(snippet)
                .url(label)
                .canonicalValue(label == null ? "" : label.toLowerCase(Locale.ROOT))
                .createdAt(now)
                .updatedAt(now)
                .embeddedEdges(new ArrayList<>())
                .build();
    }

    private static EmbeddedEdge snapshot(String edgeId, GridNode other, String relation, EdgeDirection direction,
                                         Map<String, Object> metadata, String now) {
        Object sourceUrl = metadata.get("sourceUrl");
        return EmbeddedEdge.builder()
                .edgeId(edgeId)
                .targetId(other.getId())
                .targetLabel(other.getLabel() == null ? "" : other.getLabel())
                .targetClass(NodeClass.normalize(other.getNodeClass()))
                .targetType(other.getType() == null ? "unknown" : other.getType())
                .targetProperties(TargetProperties.pick(other))
                .relationship(relation)
                .direction(direction)
                .sourceUrl(sourceUrl == null ? null : String.valueOf(sourceUrl))
                .timestamp(now)
                .metadata(metadata)
                .createdAt(now)
                .build();
    }

    private <T> T withRetry(Supplier<T> write) {
        GridStoreException last = null;
        for (int attempt = 1; attempt <= pairWriteAttempts; attempt++) {
            try {
                return write.get();
            } catch (GridStoreException e) {
                last = e;
                LOG.debugf("Edge write attempt %d of %d failed: %s", attempt, pairWriteAttempts, e.getMessage());
            }
        }
        throw last;
    }

    private static void compensate(GridStoreException failure, Supplier<?> undo) {
        try {
            undo.get();
        } catch (GridStoreException undoFailure) {
            LOG.errorf(undoFailure, "Compensation failed; edge sides are left inconsistent");
            failure.addSuppressed(undoFailure);
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static void requireProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must be provided");
        }
    }
}
