package com.cymonides.grid.model;

import java.util.List;

/**
 * Rows (1-based) and node ids picked out of a composed view by cell references.
 */
public record Selection(List<Integer> rowIndexes, List<String> nodeIds) {

    public static Selection empty() {
        return new Selection(List.of(), List.of());
    }
}
