package com.cymonides.grid.exec;

import com.cymonides.grid.model.GridRow;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.model.Selection;
import com.cymonides.grid.model.TagResult;
import com.cymonides.grid.model.WatcherResult;

import java.util.List;

/**
 * Outcome of one grid command. A command that is not grid syntax yields an execution that
 * only carries {@code error} and the echoed {@code syntax}; action results are null when
 * the command did not ask for them.
 */
public record GridExecution(String kind,
                            String error,
                            String syntax,
                            ViewDescription view,
                            List<GridRow> rows,
                            long total,
                            Selection selection,
                            PageCursor nextCursor,
                            TagResult tagApplied,
                            TagResult tagRemoved,
                            WatcherResult watcherCreated,
                            String unrecognizedAction) {

    public static final String KIND_GRID = "grid";
    public static final String NOT_GRID_SYNTAX = "Not a grid syntax command";

    public GridExecution {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static GridExecution notGridSyntax(String syntax) {
        return new GridExecution(null, NOT_GRID_SYNTAX, syntax, null, List.of(), 0,
                Selection.empty(), null, null, null, null, null);
    }

    public boolean isError() {
        return error != null;
    }
}
