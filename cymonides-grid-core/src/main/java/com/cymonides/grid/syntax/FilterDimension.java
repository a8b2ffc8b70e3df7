package com.cymonides.grid.syntax;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * What a {@code dim:value} clause does to the view. Resolved once when the command is
 * parsed; the view builder switches over it exhaustively.
 */
public enum FilterDimension {
    /** Replaces the type filter. */
    TYPE("entitytype", "topictype", "event", "theme", "project", "notes", "watchers", "goals", "tracks", "paths"),
    /** Adds a pinned node id. */
    PIN("tags"),
    CATEGORY("category"),
    FIRST_SEEN_YEAR("firstseen", "firstseenyear"),
    LAST_ARCHIVED_YEAR("lastarchived", "lastarchivedyear"),
    /** Raises the minimum age in days through {@link AgeBucket}. */
    AGE_BUCKET("agebucket"),
    /** Any other dimension, matched against node attributes of that name. */
    ATTRIBUTE();

    private static final Map<String, FilterDimension> BY_NAME = Stream.of(values())
            .flatMap(d -> Stream.of(d.names).map(n -> Map.entry(n, d)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final String[] names;

    FilterDimension(String... names) {
        this.names = names;
    }

    public static FilterDimension resolve(String dimension) {
        if (dimension == null) {
            return ATTRIBUTE;
        }
        return BY_NAME.getOrDefault(dimension.trim().toLowerCase(Locale.ROOT), ATTRIBUTE);
    }
}
