package com.cymonides.grid.exec;

import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.GridRow;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.model.Selection;
import com.cymonides.grid.model.TagResult;
import com.cymonides.grid.model.WatcherResult;
import com.cymonides.grid.mutation.GraphMutator;
import com.cymonides.grid.store.NodeStore;
import com.cymonides.grid.syntax.FilterClause;
import com.cymonides.grid.syntax.GridSyntaxParsed;
import com.cymonides.grid.syntax.GridSyntaxParser;
import com.cymonides.grid.view.CellSelector;
import com.cymonides.grid.view.RowMapper;
import com.cymonides.grid.view.ViewComposer;
import com.cymonides.grid.view.ViewRequest;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs one grid command end to end: parse, compose the view, map rows, select cells and
 * then perform the requested actions against the selected node ids, tag-add first, then
 * tag-remove, then watcher creation.
 * <p>
 * Holds no state between calls. Store failures propagate; earlier actions of the same
 * command are not rolled back.
 */
public class GridExecutor {

    private static final Logger LOG = Logger.getLogger(GridExecutor.class);

    private final GridSyntaxParser parser;
    private final ViewComposer composer;
    private final RowMapper rowMapper;
    private final CellSelector selector;
    private final GraphMutator mutator;
    private final NodeStore store;
    private final int defaultLimit;

    public GridExecutor(GridSyntaxParser parser,
                        ViewComposer composer,
                        RowMapper rowMapper,
                        CellSelector selector,
                        GraphMutator mutator,
                        NodeStore store,
                        int defaultLimit) {
        this.parser = parser;
        this.composer = composer;
        this.rowMapper = rowMapper;
        this.selector = selector;
        this.mutator = mutator;
        this.store = store;
        this.defaultLimit = defaultLimit;
    }

    public GridExecution execute(String projectId, String syntax) {
        return execute(projectId, syntax, defaultLimit, null);
    }

    public GridExecution execute(String projectId, String syntax, int limit, PageCursor cursor) {
        GridSyntaxParsed parsed = parser.parse(syntax);
        if (!parsed.gridMode()) {
            LOG.debugf("Not a grid command: '%s'", syntax);
            return GridExecution.notGridSyntax(syntax);
        }

        NodeClass viewClass = parsed.rotation() != null ? parsed.rotation()
                : parsed.classFilter() != null ? parsed.classFilter()
                : NodeClass.SUBJECT;
        NodeClass reportedClass = parsed.classFilter() != null ? parsed.classFilter() : viewClass;

        ViewRequest.Builder builder = ViewRequest.builder(projectId, viewClass)
                .type(parsed.typeFilter())
                .pins(parsed.nodeRefs())
                .limit(limit > 0 ? limit : defaultLimit)
                .cursor(cursor);
        List<String> rawFilters = new ArrayList<>();
        for (FilterClause clause : parsed.filters()) {
            builder.apply(clause);
            rawFilters.add(clause.raw());
        }
        ViewRequest request = builder.build();

        NodePage page = composer.compose(request);
        List<GridRow> rows = new ArrayList<>(page.nodes().size());
        for (GridNode node : page.nodes()) {
            rows.add(rowMapper.map(projectId, node));
        }
        Selection selection = selector.select(rows, parsed.cellRefs());
        List<String> targets = selection.nodeIds();

        TagResult tagApplied = null;
        TagResult tagRemoved = null;
        WatcherResult watcher = null;
        if (parsed.tagToApply() != null) {
            tagApplied = mutator.applyTag(projectId, targets, parsed.tagToApply());
        }
        if (parsed.tagToRemove() != null) {
            tagRemoved = mutator.removeTag(projectId, targets, parsed.tagToRemove());
        }
        if (parsed.watcherToCreate() != null) {
            watcher = mutator.createWatcher(projectId, parsed.watcherToCreate(), targets,
                    parsed.watcherTypeHint());
        }
        if (parsed.unrecognizedAction() != null) {
            LOG.warnf("Ignoring unrecognized grid action '%s'", parsed.unrecognizedAction());
        }

        ViewDescription view = new ViewDescription(
                viewClass.canonicalName(),
                reportedClass.name(),
                request.type(),
                rawFilters);
        LOG.debugf("Executed '%s' on %s: %d rows, %d selected", syntax, projectId, rows.size(), targets.size());
        return new GridExecution(GridExecution.KIND_GRID, null, syntax, view, rows, page.total(), selection,
                page.nextCursor(), tagApplied, tagRemoved, watcher, parsed.unrecognizedAction());
    }

    /**
     * Returns the stored nodes for the given ids in store order. Unknown ids are left out.
     */
    public List<GridNode> getNodesByIds(String projectId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must be provided");
        }
        return store.findByIds(projectId, ids);
    }
}
