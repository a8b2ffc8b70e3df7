package com.cymonides.grid.view;

import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.store.NodeQuery;
import com.cymonides.grid.store.NodeStore;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a {@link ViewRequest} into a single store query and returns one page of nodes.
 * <p>
 * A pin conventionally means "show this node's neighbourhood": a node matches a pinned id
 * when one of its embedded edges targets it or when it is the pinned node itself. Pins of
 * the form {@code type:X} match nodes of type X directly. The project id is never treated
 * as a pin since every node is implicitly attached to it.
 */
public class ViewComposer {

    private static final Logger LOG = Logger.getLogger(ViewComposer.class);

    public static final String TYPE_PIN_PREFIX = "type:";

    private final NodeStore store;
    private final int maxPageSize;
    private final int defaultLimit;

    public ViewComposer(NodeStore store, int maxPageSize, int defaultLimit) {
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException("maxPageSize must be positive");
        }
        this.store = store;
        this.maxPageSize = maxPageSize;
        this.defaultLimit = defaultLimit > 0 ? Math.min(defaultLimit, maxPageSize) : maxPageSize;
    }

    public NodePage compose(ViewRequest request) {
        NodeQuery query = toQuery(request);
        NodePage page = store.query(query);
        List<GridNode> nodes = page.nodes();

        PageCursor next = null;
        if (!nodes.isEmpty() && nodes.size() >= query.size()) {
            GridNode last = nodes.get(nodes.size() - 1);
            next = new PageCursor(StringUtils.defaultString(last.metadataUpdatedAt()),
                    StringUtils.defaultString(last.getId()));
        }
        LOG.debugf("View %s/%s returned %d of %d nodes (more=%s)", request.projectId(),
                request.nodeClass().canonicalName(), nodes.size(), page.total(), next != null);
        return page.withNextCursor(next);
    }

    NodeQuery toQuery(ViewRequest request) {
        NodeClass nodeClass = request.nodeClass();
        boolean lociFilters = nodeClass == NodeClass.LOCATION;

        List<String> categories = new ArrayList<>();
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        List<String> firstSeen = List.of();
        List<String> lastArchived = List.of();
        Integer minAgeDays = null;
        if (lociFilters) {
            for (String c : request.categories()) {
                if (StringUtils.isNotBlank(c)) {
                    categories.add(c.trim().toLowerCase(Locale.ROOT));
                }
            }
            request.attributes().forEach((key, values) -> {
                List<String> terms = values.stream().filter(StringUtils::isNotBlank).toList();
                if (!terms.isEmpty()) {
                    attributes.put(key, terms);
                }
            });
            firstSeen = request.firstSeenYears();
            lastArchived = request.lastArchivedYears();
            minAgeDays = request.minAgeDays();
        } else if (!request.categories().isEmpty() || !request.attributes().isEmpty()) {
            LOG.debugf("Ignoring category/attribute filters for %s rotation", nodeClass.canonicalName());
        }

        List<String> typePins = new ArrayList<>();
        List<String> nodePins = new ArrayList<>();
        for (String pin : request.pins()) {
            if (StringUtils.isBlank(pin)) {
                continue;
            }
            if (pin.startsWith(TYPE_PIN_PREFIX)) {
                String type = pin.substring(TYPE_PIN_PREFIX.length());
                if (!type.isEmpty()) {
                    typePins.add(type);
                }
            } else if (!pin.equals(request.projectId())) {
                nodePins.add(pin);
            }
        }

        PageCursor cursor = request.cursor() != null && request.cursor().isComplete() ? request.cursor() : null;
        int limit = request.limit() > 0 ? request.limit() : defaultLimit;

        return new NodeQuery(
                request.projectId(),
                nodeClass.matchNames(),
                StringUtils.trimToNull(request.type()),
                StringUtils.trimToNull(request.searchText()),
                categories,
                attributes,
                firstSeen,
                lastArchived,
                minAgeDays,
                typePins,
                nodePins,
                Math.min(limit, maxPageSize),
                cursor);
    }
}
