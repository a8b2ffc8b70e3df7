package com.cymonides.grid.syntax;

import com.cymonides.grid.model.NodeClass;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing one grid command. When {@code gridMode} is false every other field is
 * empty and the command should be treated as opaque text.
 */
public record GridSyntaxParsed(String raw,
                               boolean gridMode,
                               NodeClass rotation,
                               NodeClass classFilter,
                               String typeFilter,
                               List<String> nodeRefs,
                               String booleanOp,
                               List<FilterClause> filters,
                               List<CellReference> cellRefs,
                               List<GridAction> actions) {

    public GridSyntaxParsed {
        nodeRefs = nodeRefs == null ? List.of() : List.copyOf(nodeRefs);
        filters = filters == null ? List.of() : List.copyOf(filters);
        cellRefs = cellRefs == null ? List.of() : List.copyOf(cellRefs);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static GridSyntaxParsed notGrid(String raw) {
        return new GridSyntaxParsed(raw == null ? "" : raw, false, null, null, null,
                List.of(), null, List.of(), List.of(), List.of());
    }

    /** First action of the given kind, if any. */
    public Optional<GridAction> action(GridAction.Kind kind) {
        return actions.stream().filter(a -> a.kind() == kind).findFirst();
    }

    public String tagToApply() {
        return action(GridAction.Kind.TAG_ADD).map(GridAction::label).orElse(null);
    }

    public String tagToRemove() {
        return action(GridAction.Kind.TAG_REMOVE).map(GridAction::label).orElse(null);
    }

    public String watcherToCreate() {
        return action(GridAction.Kind.WATCHER).map(GridAction::label).orElse(null);
    }

    public String watcherTypeHint() {
        return action(GridAction.Kind.WATCHER).map(GridAction::typeHint).orElse(null);
    }

    public String unrecognizedAction() {
        return action(GridAction.Kind.UNRECOGNIZED).map(GridAction::raw).orElse(null);
    }
}
