package com.cymonides.grid.mongo;

import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.store.GridStoreException;
import com.cymonides.grid.store.NodeQuery;
import com.cymonides.grid.store.NodeStore;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonType;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.cymonides.grid.mongo.NodeDocumentMapper.DIRECTION;
import static com.cymonides.grid.mongo.NodeDocumentMapper.EDGE_ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.EMBEDDED_EDGES;
import static com.cymonides.grid.mongo.NodeDocumentMapper.ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.NODE_ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.TARGET_ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.TYPE;
import static com.cymonides.grid.mongo.NodeDocumentMapper.UPDATED_AT_PATH;

/**
 * {@link NodeStore} over one Mongo collection per project, named
 * {@code collectionPrefix + projectId}.
 * <p>
 * Collections are used with majority write concern and primary reads so that a node read
 * right after an edge write sees that write. Edge writes are single-document conditional
 * updates and are safe to repeat.
 */
public class MongoNodeStore implements NodeStore {

    private static final Logger LOG = Logger.getLogger(MongoNodeStore.class);

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionPrefix;
    private final Set<String> indexedCollections = ConcurrentHashMap.newKeySet();

    public MongoNodeStore(MongoClient mongoClient, String databaseName, String collectionPrefix) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionPrefix = collectionPrefix;
    }

    public String collectionName(String projectId) {
        return collectionPrefix + projectId;
    }

    MongoCollection<Document> collection(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must be provided");
        }
        String name = collectionName(projectId);
        MongoCollection<Document> coll = mongoClient.getDatabase(databaseName)
                .getCollection(name)
                .withWriteConcern(WriteConcern.MAJORITY)
                .withReadPreference(ReadPreference.primary());
        if (indexedCollections.add(name)) {
            ensureIndexes(coll);
        }
        return coll;
    }

    void ensureIndexes(MongoCollection<Document> coll) {
        // recency order used by every view
        coll.createIndex(Indexes.compoundIndex(Indexes.descending(UPDATED_AT_PATH), Indexes.descending(NODE_ID)),
                new IndexOptions().name("updated_id"));
        coll.createIndex(Indexes.ascending(EMBEDDED_EDGES + "." + TARGET_ID),
                new IndexOptions().name("edge_target"));
        coll.createIndex(Indexes.ascending(TYPE), new IndexOptions().name("type"));
    }

    @Override
    public List<GridNode> findByIds(String projectId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return call(projectId, "findByIds", () -> {
            List<GridNode> out = new ArrayList<>();
            for (Document d : collection(projectId).find(Filters.in(ID, new ArrayList<>(ids)))) {
                out.add(NodeDocumentMapper.toNode(d));
            }
            return out;
        });
    }

    @Override
    public NodePage query(NodeQuery query) {
        return call(query.projectId(), "query", () -> {
            MongoCollection<Document> coll = collection(query.projectId());
            List<GridNode> nodes = new ArrayList<>();
            for (Document d : coll.find(MongoNodeQueryTranslator.toFilter(query))
                    .sort(MongoNodeQueryTranslator.SORT)
                    .limit(query.size())) {
                nodes.add(NodeDocumentMapper.toNode(d));
            }
            long total = coll.countDocuments(MongoNodeQueryTranslator.toCountFilter(query));
            return new NodePage(nodes, total, null);
        });
    }

    @Override
    public boolean insertNew(String projectId, GridNode node) {
        return call(projectId, "insertNew", () -> {
            try {
                collection(projectId).insertOne(NodeDocumentMapper.toDocument(node));
                return true;
            } catch (MongoWriteException e) {
                if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                    throw e;
                }
                LOG.debugf("Node id %s already taken in %s", node.getId(), projectId);
                return false;
            }
        });
    }

    @Override
    public GridNode insertIfAbsent(String projectId, GridNode node) {
        return call(projectId, "insertIfAbsent", () -> {
            MongoCollection<Document> coll = collection(projectId);
            Document doc = NodeDocumentMapper.toDocument(node);
            doc.remove(ID);
            try {
                coll.updateOne(Filters.eq(ID, node.getId()), new Document("$setOnInsert", doc),
                        new UpdateOptions().upsert(true));
            } catch (MongoWriteException e) {
                // a concurrent upsert of the same id won; the stored node is read below
                if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                    throw e;
                }
                LOG.debugf("Node %s was created concurrently in %s", node.getId(), projectId);
            }
            Document stored = coll.find(Filters.eq(ID, node.getId())).first();
            return stored == null ? node : NodeDocumentMapper.toNode(stored);
        });
    }

    @Override
    public boolean appendEdge(String projectId, String nodeId, EmbeddedEdge edge) {
        return call(projectId, "appendEdge", () -> {
            MongoCollection<Document> coll = collection(projectId);
            Bson filter = appendFilter(nodeId, edge);
            Bson push = Updates.push(EMBEDDED_EDGES, NodeDocumentMapper.toDocument(edge));
            UpdateResult result;
            try {
                result = coll.updateOne(filter, push);
            } catch (MongoWriteException e) {
                // embedded_edges holds something other than an array; reset it and try once more
                long reset = coll.updateOne(
                        Filters.and(Filters.eq(ID, nodeId),
                                Filters.not(Filters.type(EMBEDDED_EDGES, BsonType.ARRAY))),
                        Updates.set(EMBEDDED_EDGES, new ArrayList<>())).getModifiedCount();
                if (reset == 0) {
                    throw e;
                }
                LOG.warnf("Reset non-array %s on node %s in %s", EMBEDDED_EDGES, nodeId, projectId);
                result = coll.updateOne(filter, push);
            }
            return result.getModifiedCount() == 1;
        });
    }

    @Override
    public List<EmbeddedEdge> removeEdge(String projectId, String nodeId, String edgeId) {
        return call(projectId, "removeEdge", () -> {
            Document before = collection(projectId).findOneAndUpdate(
                    Filters.and(Filters.eq(ID, nodeId), Filters.elemMatch(EMBEDDED_EDGES, Filters.eq(EDGE_ID, edgeId))),
                    Updates.pull(EMBEDDED_EDGES, new Document(EDGE_ID, edgeId)),
                    new FindOneAndUpdateOptions()
                            .returnDocument(ReturnDocument.BEFORE)
                            .projection(Projections.include(EMBEDDED_EDGES)));
            List<EmbeddedEdge> removed = new ArrayList<>();
            if (before != null && before.get(EMBEDDED_EDGES) instanceof List<?> edges) {
                for (Object entry : edges) {
                    if (entry instanceof Map<?, ?> m && edgeId.equals(m.get(EDGE_ID))) {
                        removed.add(NodeDocumentMapper.toEdge(m));
                    }
                }
            }
            return removed;
        });
    }

    /**
     * Matches the node only while it has no entry with the same edge id and direction.
     */
    static Bson appendFilter(String nodeId, EmbeddedEdge edge) {
        String direction = edge.getDirection() == null ? null : edge.getDirection().wireName();
        return Filters.and(
                Filters.eq(ID, nodeId),
                Filters.not(Filters.elemMatch(EMBEDDED_EDGES,
                        Filters.and(Filters.eq(EDGE_ID, edge.getEdgeId()), Filters.eq(DIRECTION, direction)))));
    }

    private <T> T call(String projectId, String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (MongoException e) {
            LOG.errorf(e, "Mongo %s failed for project %s", operation, projectId);
            throw new GridStoreException(projectId, "Node store " + operation + " failed for project " + projectId, e);
        }
    }
}
