package com.cymonides.grid.mongo;

import com.cymonides.grid.config.GridConfig;
import com.cymonides.grid.model.EdgeDirection;
import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.store.NodeQuery;
import com.cymonides.grid.store.NodeStore;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the Mongo node store against a real server started by Dev Services.
 */
@QuarkusTest
public class MongoNodeStoreIT {

    private static final String PROJECT = "it-project";

    @Inject
    NodeStore nodeStore;

    @Inject
    MongoClient mongoClient;

    @Inject
    GridConfig config;

    private MongoNodeStore store;
    private MongoCollection<Document> raw;

    @BeforeEach
    void clean() {
        assertInstanceOf(MongoNodeStore.class, nodeStore, "producer should wire the Mongo store by default");
        store = (MongoNodeStore) nodeStore;
        raw = mongoClient.getDatabase(config.store().database()).getCollection(store.collectionName(PROJECT));
        raw.deleteMany(new Document());
    }

    private static GridNode node(String id, String updatedAt) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (updatedAt != null) {
            meta.put("updated_at", updatedAt);
        }
        return GridNode.builder().id(id).label("Node " + id).nodeClass("subject").type("person")
                .metadata(meta).build();
    }

    private static EmbeddedEdge edge(String edgeId, String target, EdgeDirection direction) {
        return EmbeddedEdge.builder().edgeId(edgeId).targetId(target).targetLabel("Node " + target)
                .targetClass("subject").targetType("person").relationship("knows").direction(direction)
                .timestamp("2024-01-01T00:00:00Z").build();
    }

    private List<EmbeddedEdge> edgesOf(String id) {
        return store.findById(PROJECT, id).orElseThrow().getEmbeddedEdges();
    }

    @Test
    public void appendEdge_twice_keepsOneEntry() {
        store.insertNew(PROJECT, node("n1", "2024-01-01"));
        EmbeddedEdge e = edge("e1", "n2", EdgeDirection.OUTGOING);

        assertTrue(store.appendEdge(PROJECT, "n1", e));
        assertFalse(store.appendEdge(PROJECT, "n1", e));
        assertEquals(1, edgesOf("n1").size());

        assertTrue(store.appendEdge(PROJECT, "n1", edge("e1", "n2", EdgeDirection.INCOMING)),
                "the other direction is a separate slot");
        assertEquals(2, edgesOf("n1").size());
        assertFalse(store.appendEdge(PROJECT, "missing", e));
    }

    @Test
    public void removeEdge_returnsRemovedEntries_thenNothing() {
        store.insertNew(PROJECT, node("n1", "2024-01-01"));
        store.appendEdge(PROJECT, "n1", edge("e1", "n2", EdgeDirection.OUTGOING));
        store.appendEdge(PROJECT, "n1", edge("e2", "n3", EdgeDirection.OUTGOING));

        List<EmbeddedEdge> removed = store.removeEdge(PROJECT, "n1", "e1");
        assertEquals(1, removed.size());
        assertEquals("n2", removed.get(0).getTargetId());
        assertEquals(EdgeDirection.OUTGOING, removed.get(0).getDirection());
        assertEquals(List.of("e2"), edgesOf("n1").stream().map(EmbeddedEdge::getEdgeId).toList());

        assertTrue(store.removeEdge(PROJECT, "n1", "e1").isEmpty());
        assertTrue(store.removeEdge(PROJECT, "missing", "e1").isEmpty());
    }

    @Test
    public void appendEdge_resetsNonArrayEdgeField() {
        raw.insertOne(new Document("_id", "n1").append("id", "n1").append("node_class", "subject")
                .append("embedded_edges", "corrupt"));

        assertTrue(store.appendEdge(PROJECT, "n1", edge("e1", "n2", EdgeDirection.OUTGOING)));
        assertEquals(List.of("e1"), edgesOf("n1").stream().map(EmbeddedEdge::getEdgeId).toList());
    }

    @Test
    public void insertIfAbsent_concurrentCallers_allSeeStoredNode() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Callable<GridNode>> tasks = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                GridNode candidate = node("tag:flagged", "2024-01-01");
                candidate.setLabel("Flagged " + i);
                tasks.add(() -> store.insertIfAbsent(PROJECT, candidate));
            }
            Set<String> labels = new HashSet<>();
            for (Future<GridNode> f : pool.invokeAll(tasks)) {
                labels.add(f.get().getLabel());
            }
            assertEquals(1, labels.size(), "every caller sees the same stored node");
            assertEquals(labels.iterator().next(), store.findById(PROJECT, "tag:flagged").orElseThrow().getLabel());
            assertEquals(1, raw.countDocuments());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void insertNew_refusesTakenId() {
        assertTrue(store.insertNew(PROJECT, node("w1", "2024-01-01")));
        GridNode other = node("w1", "2024-02-01");
        other.setLabel("Other");
        assertFalse(store.insertNew(PROJECT, other));
        assertEquals("Node w1", store.findById(PROJECT, "w1").orElseThrow().getLabel());
    }

    @Test
    public void query_pagesAcrossDatedAndUndatedNodes() {
        store.insertNew(PROJECT, node("n3", "2024-01-03"));
        store.insertNew(PROJECT, node("n2", "2024-01-02"));
        store.insertNew(PROJECT, node("n1", null));

        NodePage first = store.query(query(2, null));
        assertEquals(List.of("n3", "n2"), ids(first));
        assertEquals(3, first.total());

        NodePage second = store.query(query(2, new PageCursor("2024-01-02", "n2")));
        assertEquals(List.of("n1"), ids(second));

        assertTrue(store.query(query(2, new PageCursor("", "n1"))).nodes().isEmpty());
    }

    private static NodeQuery query(int size, PageCursor cursor) {
        return new NodeQuery(PROJECT, NodeClass.SUBJECT.matchNames(), null, null, List.of(), Map.of(),
                List.of(), List.of(), null, List.of(), List.of(), size, cursor);
    }

    private static List<String> ids(NodePage page) {
        return page.nodes().stream().map(GridNode::getId).toList();
    }
}
