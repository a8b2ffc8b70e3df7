package com.cymonides.grid.store;

import com.cymonides.grid.model.PageCursor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fully resolved, store-neutral node query. Every non-empty group must match (AND);
 * values inside one group are alternatives (OR). Type pins and node pins together form a
 * single group. {@code cursor} is only set when it carries both tie-break fields.
 */
public record NodeQuery(String projectId,
                        Set<String> classNames,
                        String type,
                        String searchText,
                        List<String> categories,
                        Map<String, List<String>> attributes,
                        List<String> firstSeenYears,
                        List<String> lastArchivedYears,
                        Integer minAgeDays,
                        List<String> typePins,
                        List<String> nodePins,
                        int size,
                        PageCursor cursor) {

    public NodeQuery {
        classNames = classNames == null ? Set.of() : Set.copyOf(classNames);
        categories = categories == null ? List.of() : List.copyOf(categories);
        attributes = copyAttributes(attributes);
        firstSeenYears = firstSeenYears == null ? List.of() : List.copyOf(firstSeenYears);
        lastArchivedYears = lastArchivedYears == null ? List.of() : List.copyOf(lastArchivedYears);
        typePins = typePins == null ? List.of() : List.copyOf(typePins);
        nodePins = nodePins == null ? List.of() : List.copyOf(nodePins);
    }

    private static Map<String, List<String>> copyAttributes(Map<String, List<String>> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        attributes.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public boolean hasPins() {
        return !typePins.isEmpty() || !nodePins.isEmpty();
    }
}
