package com.cymonides.grid.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record GridRow(PrimaryNode primaryNode,
                      Map<String, List<RowNode>> relatedNodes,
                      List<TagRef> tags) {

    public GridRow {
        Map<String, List<RowNode>> related = new LinkedHashMap<>();
        if (relatedNodes != null) {
            relatedNodes.forEach((k, v) -> related.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        relatedNodes = Collections.unmodifiableMap(related);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public List<RowNode> related(RelatedBucket bucket) {
        List<RowNode> nodes = relatedNodes.get(bucket.key());
        return nodes == null ? List.of() : nodes;
    }
}
