package com.cymonides.grid.view;

import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.syntax.AgeBucket;
import com.cymonides.grid.syntax.FilterClause;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a view rotation needs: the pivot class plus the optional filter groups.
 * Category, attribute and temporal filters only take effect for the LOCATION rotation.
 */
public final class ViewRequest {

    private final String projectId;
    private final NodeClass nodeClass;
    private final String type;
    private final List<String> pins;
    private final List<String> categories;
    private final Map<String, List<String>> attributes;
    private final List<String> firstSeenYears;
    private final List<String> lastArchivedYears;
    private final Integer minAgeDays;
    private final String searchText;
    private final int limit;
    private final PageCursor cursor;

    private ViewRequest(Builder b) {
        this.projectId = b.projectId;
        this.nodeClass = b.nodeClass;
        this.type = b.type;
        this.pins = List.copyOf(b.pins);
        this.categories = List.copyOf(b.categories);
        Map<String, List<String>> attrs = new LinkedHashMap<>();
        b.attributes.forEach((k, v) -> attrs.put(k, List.copyOf(v)));
        this.attributes = Collections.unmodifiableMap(attrs);
        this.firstSeenYears = List.copyOf(b.firstSeenYears);
        this.lastArchivedYears = List.copyOf(b.lastArchivedYears);
        this.minAgeDays = b.minAgeDays;
        this.searchText = b.searchText;
        this.limit = b.limit;
        this.cursor = b.cursor;
    }

    public static Builder builder(String projectId, NodeClass nodeClass) {
        return new Builder(projectId, nodeClass);
    }

    public String projectId() { return projectId; }
    public NodeClass nodeClass() { return nodeClass; }
    public String type() { return type; }
    public List<String> pins() { return pins; }
    public List<String> categories() { return categories; }
    public Map<String, List<String>> attributes() { return attributes; }
    public List<String> firstSeenYears() { return firstSeenYears; }
    public List<String> lastArchivedYears() { return lastArchivedYears; }
    public Integer minAgeDays() { return minAgeDays; }
    public String searchText() { return searchText; }
    public int limit() { return limit; }
    public PageCursor cursor() { return cursor; }

    public static final class Builder {
        private final String projectId;
        private final NodeClass nodeClass;
        private String type;
        private final List<String> pins = new ArrayList<>();
        private final List<String> categories = new ArrayList<>();
        private final Map<String, List<String>> attributes = new LinkedHashMap<>();
        private final List<String> firstSeenYears = new ArrayList<>();
        private final List<String> lastArchivedYears = new ArrayList<>();
        private Integer minAgeDays;
        private String searchText;
        private int limit;
        private PageCursor cursor;

        private Builder(String projectId, NodeClass nodeClass) {
            if (projectId == null || projectId.isBlank()) {
                throw new IllegalArgumentException("projectId must be provided");
            }
            this.projectId = projectId;
            this.nodeClass = Objects.requireNonNull(nodeClass, "nodeClass");
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder pins(Collection<String> ids) {
            if (ids != null) {
                pins.addAll(ids);
            }
            return this;
        }

        public Builder pin(String id) {
            pins.add(id);
            return this;
        }

        public Builder category(String category) {
            categories.add(category);
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder firstSeenYear(String year) {
            firstSeenYears.add(year);
            return this;
        }

        public Builder lastArchivedYear(String year) {
            lastArchivedYears.add(year);
            return this;
        }

        /** Keeps the largest minimum seen so far. */
        public Builder minAgeDays(int days) {
            this.minAgeDays = minAgeDays == null ? days : Math.max(minAgeDays, days);
            return this;
        }

        public Builder searchText(String text) {
            this.searchText = text;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder cursor(PageCursor cursor) {
            this.cursor = cursor;
            return this;
        }

        /**
         * Applies one parsed filter clause. Clauses without a value have no effect, as do
         * unknown age buckets.
         */
        public Builder apply(FilterClause clause) {
            if (clause == null || !clause.hasValue()) {
                return this;
            }
            String value = clause.value();
            return switch (clause.kind()) {
                case TYPE -> type(value);
                case PIN -> pin(value);
                case CATEGORY -> category(value);
                case FIRST_SEEN_YEAR -> firstSeenYear(value);
                case LAST_ARCHIVED_YEAR -> lastArchivedYear(value);
                case AGE_BUCKET -> AgeBucket.fromLabel(value)
                        .map(bucket -> minAgeDays(bucket.minDays()))
                        .orElse(this);
                case ATTRIBUTE -> attribute(clause.dimension(), value);
            };
        }

        public ViewRequest build() {
            return new ViewRequest(this);
        }
    }
}
