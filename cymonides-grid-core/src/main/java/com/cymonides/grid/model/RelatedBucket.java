package com.cymonides.grid.model;

/**
 * Buckets of a row's related nodes, in display order. The last three mirror the first
 * ones under the names older clients still read.
 */
public enum RelatedBucket {
    LOCATIONS("locations"),
    NEXUS("nexus"),
    SUBJECTS("subjects"),
    NARRATIVES("narratives"),
    SOURCES("sources"),
    QUERIES("queries"),
    ENTITIES("entities");

    private final String key;

    RelatedBucket(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
