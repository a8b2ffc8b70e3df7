package com.cymonides.grid.view;

import com.cymonides.grid.model.GridRow;
import com.cymonides.grid.model.RelatedBucket;
import com.cymonides.grid.model.RowNode;
import com.cymonides.grid.model.Selection;
import com.cymonides.grid.syntax.CellReference;
import com.cymonides.grid.syntax.CellReference.Column;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves cell references against composed rows.
 * <p>
 * Rows are 1-based. Without references every row's primary node is selected. Row numbers
 * outside the composed rows are ignored; when none remain all rows are used. Without a
 * column the primary column applies.
 */
public class CellSelector {

    public Selection select(List<GridRow> rows, List<CellReference> refs) {
        if (rows == null || rows.isEmpty()) {
            return Selection.empty();
        }
        int rowCount = rows.size();

        if (refs == null || refs.isEmpty()) {
            List<Integer> all = new ArrayList<>(rowCount);
            List<String> ids = new ArrayList<>(rowCount);
            for (int i = 0; i < rowCount; i++) {
                all.add(i + 1);
                String id = primaryId(rows.get(i));
                if (id != null) {
                    ids.add(id);
                }
            }
            return new Selection(all, ids);
        }

        TreeSet<Integer> rowIndexes = new TreeSet<>();
        Set<Column> columns = EnumSet.noneOf(Column.class);
        for (CellReference ref : refs) {
            switch (ref.kind()) {
                case COLUMN -> columns.add(ref.column());
                case ROW -> rowIndexes.add(ref.row());
                case CELL -> {
                    rowIndexes.add(ref.row());
                    columns.add(ref.column());
                }
                case RANGE -> {
                    for (int r = Math.max(1, ref.row()); r <= Math.min(ref.rowEnd(), rowCount); r++) {
                        rowIndexes.add(r);
                    }
                    columns.add(ref.column());
                }
            }
        }

        rowIndexes.removeIf(r -> r < 1 || r > rowCount);
        if (rowIndexes.isEmpty()) {
            for (int r = 1; r <= rowCount; r++) {
                rowIndexes.add(r);
            }
        }
        if (columns.isEmpty()) {
            columns.add(Column.A);
        }
        boolean primary = columns.stream().anyMatch(Column::isPrimary);
        boolean related = columns.contains(Column.C);

        Set<String> nodeIds = new LinkedHashSet<>();
        for (int idx : rowIndexes) {
            GridRow row = rows.get(idx - 1);
            if (primary) {
                String id = primaryId(row);
                if (id != null) {
                    nodeIds.add(id);
                }
            }
            if (related) {
                for (RelatedBucket bucket : RelatedBucket.values()) {
                    for (RowNode node : row.related(bucket)) {
                        if (node.id() != null) {
                            nodeIds.add(node.id());
                        }
                    }
                }
            }
        }
        return new Selection(List.copyOf(rowIndexes), List.copyOf(nodeIds));
    }

    private static String primaryId(GridRow row) {
        return row.primaryNode() == null ? null : row.primaryNode().id();
    }
}
