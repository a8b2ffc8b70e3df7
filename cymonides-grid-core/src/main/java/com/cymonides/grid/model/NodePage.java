package com.cymonides.grid.model;

import java.util.List;

public record NodePage(List<GridNode> nodes, long total, PageCursor nextCursor) {

    public NodePage {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public NodePage withNextCursor(PageCursor cursor) {
        return new NodePage(nodes, total, cursor);
    }
}
