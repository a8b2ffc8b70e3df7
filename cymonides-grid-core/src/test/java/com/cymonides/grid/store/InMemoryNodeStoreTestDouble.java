package com.cymonides.grid.store;

import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.model.PageCursor;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A minimal in-memory NodeStore for unit tests. Applies the same matching rules as the
 * Mongo translator, hands out copies so callers cannot mutate stored state, and can be
 * told to fail the next N edge writes on a given node.
 */
public class InMemoryNodeStoreTestDouble implements NodeStore {

    private final Map<String, Map<String, GridNode>> byProject = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> appendFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> removeFailures = new ConcurrentHashMap<>();
    private final AtomicInteger queryCount = new AtomicInteger();
    private NodeQuery lastQuery;

    public void put(String projectId, GridNode node) {
        bucket(projectId).put(node.getId(), copy(node));
    }

    public Optional<GridNode> get(String projectId, String id) {
        return Optional.ofNullable(bucket(projectId).get(id)).map(InMemoryNodeStoreTestDouble::copy);
    }

    public int size(String projectId) {
        return bucket(projectId).size();
    }

    public void failNextAppends(String nodeId, int times) {
        appendFailures.put(nodeId, new AtomicInteger(times));
    }

    public void failNextRemoves(String nodeId, int times) {
        removeFailures.put(nodeId, new AtomicInteger(times));
    }

    public int getQueryCount() {
        return queryCount.get();
    }

    public NodeQuery getLastQuery() {
        return lastQuery;
    }

    private Map<String, GridNode> bucket(String projectId) {
        return byProject.computeIfAbsent(projectId, p -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    @Override
    public List<GridNode> findByIds(String projectId, Collection<String> ids) {
        Map<String, GridNode> nodes = bucket(projectId);
        List<GridNode> out = new ArrayList<>();
        synchronized (nodes) {
            for (GridNode n : nodes.values()) if (ids.contains(n.getId())) out.add(copy(n));
        }
        return out;
    }

    @Override
    public NodePage query(NodeQuery query) {
        queryCount.incrementAndGet();
        lastQuery = query;
        List<GridNode> matches = new ArrayList<>();
        Map<String, GridNode> nodes = bucket(query.projectId());
        synchronized (nodes) {
            for (GridNode n : nodes.values()) if (matches(n, query)) matches.add(n);
        }
        matches.sort(RECENCY);
        long total = matches.size();
        List<GridNode> page = new ArrayList<>();
        for (GridNode n : matches) {
            if (query.cursor() != null && !after(n, query.cursor())) continue;
            if (page.size() >= query.size()) break;
            page.add(copy(n));
        }
        return new NodePage(page, total, null);
    }

    @Override
    public boolean insertNew(String projectId, GridNode node) {
        return bucket(projectId).putIfAbsent(node.getId(), copy(node)) == null;
    }

    @Override
    public GridNode insertIfAbsent(String projectId, GridNode node) {
        GridNode stored = bucket(projectId).computeIfAbsent(node.getId(), id -> copy(node));
        return copy(stored);
    }

    @Override
    public boolean appendEdge(String projectId, String nodeId, EmbeddedEdge edge) {
        maybeFail(appendFailures, projectId, nodeId, "append");
        Map<String, GridNode> nodes = bucket(projectId);
        synchronized (nodes) {
            GridNode n = nodes.get(nodeId);
            if (n == null) return false;
            if (n.getEmbeddedEdges() == null) n.setEmbeddedEdges(new ArrayList<>());
            for (EmbeddedEdge e : n.getEmbeddedEdges()) if (e.sameSlot(edge)) return false;
            n.getEmbeddedEdges().add(copy(edge));
            return true;
        }
    }

    @Override
    public List<EmbeddedEdge> removeEdge(String projectId, String nodeId, String edgeId) {
        maybeFail(removeFailures, projectId, nodeId, "remove");
        Map<String, GridNode> nodes = bucket(projectId);
        synchronized (nodes) {
            GridNode n = nodes.get(nodeId);
            if (n == null || n.getEmbeddedEdges() == null) return List.of();
            List<EmbeddedEdge> removed = new ArrayList<>();
            Iterator<EmbeddedEdge> it = n.getEmbeddedEdges().iterator();
            while (it.hasNext()) {
                EmbeddedEdge e = it.next();
                if (edgeId.equals(e.getEdgeId())) {
                    removed.add(copy(e));
                    it.remove();
                }
            }
            return removed;
        }
    }

    private static void maybeFail(Map<String, AtomicInteger> failures, String projectId, String nodeId, String op) {
        AtomicInteger left = failures.get(nodeId);
        if (left != null && left.getAndDecrement() > 0) {
            throw new GridStoreException(projectId, "injected " + op + " failure on " + nodeId, null);
        }
    }

    // ---- matching, mirrors the Mongo translator ----

    // strings descending, then null/missing (BSON null sorts below strings), ties by id descending
    private static final Comparator<GridNode> RECENCY = Comparator
            .comparing(InMemoryNodeStoreTestDouble::seenAt, Comparator.nullsLast(Comparator.<String>reverseOrder()))
            .thenComparing(n -> Objects.toString(n.getId(), ""), Comparator.reverseOrder());

    private static String seenAt(GridNode n) {
        Object v = n.getMetadata() == null ? null : n.getMetadata().get("updated_at");
        return v instanceof String s ? s : null;
    }

    private static boolean after(GridNode n, PageCursor cursor) {
        String seen = seenAt(n);
        boolean idBefore = n.getId().compareTo(cursor.lastNodeId()) < 0;
        if (cursor.isUndated()) {
            return seen == null && idBefore;
        }
        if (seen == null) {
            return true;
        }
        int cmp = seen.compareTo(cursor.lastSeenAt());
        return cmp < 0 || (cmp == 0 && idBefore);
    }

    private static boolean matches(GridNode n, NodeQuery q) {
        if (!q.classNames().isEmpty() && !q.classNames().contains(NodeClass.normalize(n.getNodeClass()))) return false;
        if (q.type() != null && !q.type().equals(n.getType())) return false;
        if (q.searchText() != null) {
            String label = n.getLabel() == null ? "" : n.getLabel().toLowerCase(Locale.ROOT);
            if (!label.contains(q.searchText().toLowerCase(Locale.ROOT))) return false;
        }
        if (!q.categories().isEmpty()
                && !anyIn(q.categories(), path(n.getProperties(), "category"), path(n.getMetadata(), "category"))) {
            return false;
        }
        for (Map.Entry<String, List<String>> attr : q.attributes().entrySet()) {
            String key = attr.getKey();
            List<Object> candidates = new ArrayList<>(List.of(
                    Objects.requireNonNullElse(path(n.getMetadata(), "categoryAttributes." + key), List.of()),
                    Objects.requireNonNullElse(path(n.getMetadata(), key), List.of()),
                    Objects.requireNonNullElse(path(n.getProperties(), key), List.of())));
            if ("dates".equals(key)) {
                candidates.add(Objects.requireNonNullElse(path(n.getMetadata(), "year"), List.of()));
                candidates.add(Objects.requireNonNullElse(path(n.getProperties(), "year"), List.of()));
            }
            if (!anyIn(attr.getValue(), candidates.toArray())) return false;
        }
        if (!q.firstSeenYears().isEmpty()
                && !anyIn(q.firstSeenYears(), path(n.getMetadata(), "temporal.first_seen_year"))) return false;
        if (!q.lastArchivedYears().isEmpty()
                && !anyIn(q.lastArchivedYears(), path(n.getMetadata(), "temporal.last_archived_year"))) return false;
        if (q.minAgeDays() != null) {
            Object age = path(n.getMetadata(), "temporal.age_days");
            if (!(age instanceof Number num) || num.doubleValue() < q.minAgeDays()) return false;
        }
        if (q.hasPins()) {
            boolean pinned = n.getType() != null && q.typePins().contains(n.getType());
            pinned |= q.nodePins().contains(n.getId());
            if (n.getEmbeddedEdges() != null) {
                for (EmbeddedEdge e : n.getEmbeddedEdges()) pinned |= q.nodePins().contains(e.getTargetId());
            }
            if (!pinned) return false;
        }
        return true;
    }

    private static boolean anyIn(List<String> wanted, Object... values) {
        for (Object v : values) {
            if (v instanceof Collection<?> c) {
                for (Object item : c) if (item != null && wanted.contains(String.valueOf(item))) return true;
            } else if (v != null && wanted.contains(String.valueOf(v))) {
                return true;
            }
        }
        return false;
    }

    private static Object path(Map<String, Object> root, String dotted) {
        Object cur = root;
        for (String part : dotted.split("\\.")) {
            if (!(cur instanceof Map<?, ?> m)) return null;
            cur = m.get(part);
        }
        return cur;
    }

    // ---- copies ----

    static GridNode copy(GridNode n) {
        List<EmbeddedEdge> edges = new ArrayList<>();
        if (n.getEmbeddedEdges() != null) for (EmbeddedEdge e : n.getEmbeddedEdges()) edges.add(copy(e));
        return n.toBuilder()
                .metadata(n.getMetadata() == null ? null : new LinkedHashMap<>(n.getMetadata()))
                .properties(n.getProperties() == null ? null : new LinkedHashMap<>(n.getProperties()))
                .embeddedEdges(edges)
                .build();
    }

    static EmbeddedEdge copy(EmbeddedEdge e) {
        return e.toBuilder()
                .metadata(e.getMetadata() == null ? null : new LinkedHashMap<>(e.getMetadata()))
                .targetProperties(e.getTargetProperties() == null ? null : new LinkedHashMap<>(e.getTargetProperties()))
                .build();
    }
}
