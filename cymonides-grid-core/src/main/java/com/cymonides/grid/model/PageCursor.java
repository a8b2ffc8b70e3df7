package com.cymonides.grid.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Tie-break fields of the last node of a page. Both fields are required to resume;
 * a cursor missing either one restarts paging from the top.
 * <p>
 * An empty {@code lastSeenAt} marks a node without an {@code updated_at} value. Such nodes
 * sort after every dated node, so resuming from one only walks the undated tail.
 */
public record PageCursor(String lastSeenAt, String lastNodeId) {

    public boolean isComplete() {
        return lastSeenAt != null && StringUtils.isNotEmpty(lastNodeId);
    }

    public boolean isUndated() {
        return lastSeenAt != null && lastSeenAt.isEmpty();
    }
}
