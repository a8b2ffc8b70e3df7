package com.cymonides.grid.store;

import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodePage;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the per-project node document store.
 * <p>
 * Every method is scoped to one project partition. Edge writes are atomic updates of a
 * single document and must be visible to the next read issued by the same caller.
 * Implementations report failures as {@link GridStoreException}.
 */
public interface NodeStore {

    List<GridNode> findByIds(String projectId, Collection<String> ids);

    default Optional<GridNode> findById(String projectId, String id) {
        return findByIds(projectId, List.of(id)).stream().findFirst();
    }

    /**
     * Runs a query and returns one page ordered by {@code metadata.updated_at} then id,
     * both descending. {@code total} counts every match regardless of the cursor. The
     * returned page never carries a next cursor; callers derive it.
     */
    NodePage query(NodeQuery query);

    /**
     * Stores the node only when no document with its id exists.
     *
     * @return true when this call created the document, false when the id was taken
     */
    boolean insertNew(String projectId, GridNode node);

    /**
     * Stores the node only when no document with its id exists and returns whatever is
     * stored afterwards.
     */
    GridNode insertIfAbsent(String projectId, GridNode node);

    /**
     * Appends the edge unless the node already holds an entry with the same edge id and
     * direction.
     *
     * @return true when the edge was appended, false when it was already present or the
     *         node does not exist
     */
    boolean appendEdge(String projectId, String nodeId, EmbeddedEdge edge);

    /**
     * Removes every entry with the given edge id.
     *
     * @return the removed entries, empty when there was nothing to remove or the node does
     *         not exist
     */
    List<EmbeddedEdge> removeEdge(String projectId, String nodeId, String edgeId);
}
