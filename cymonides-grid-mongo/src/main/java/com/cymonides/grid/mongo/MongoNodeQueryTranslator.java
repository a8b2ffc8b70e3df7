package com.cymonides.grid.mongo;

import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.store.NodeQuery;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.apache.commons.lang3.StringUtils;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

import static com.cymonides.grid.mongo.NodeDocumentMapper.EMBEDDED_EDGES;
import static com.cymonides.grid.mongo.NodeDocumentMapper.LEGACY_CLASS;
import static com.cymonides.grid.mongo.NodeDocumentMapper.NODE_CLASS;
import static com.cymonides.grid.mongo.NodeDocumentMapper.NODE_ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.TARGET_ID;
import static com.cymonides.grid.mongo.NodeDocumentMapper.TYPE;
import static com.cymonides.grid.mongo.NodeDocumentMapper.UPDATED_AT_PATH;

/**
 * Translates a {@link NodeQuery} into a Mongo filter and sort. Groups are combined with
 * {@code $and}; alternatives inside a group with {@code $or} or {@code $in}.
 */
public final class MongoNodeQueryTranslator {

    public static final Bson SORT = Sorts.orderBy(Sorts.descending(UPDATED_AT_PATH), Sorts.descending(NODE_ID));

    private MongoNodeQueryTranslator() {
    }

    /** The full filter including the resume cursor. */
    public static Bson toFilter(NodeQuery query) {
        List<Bson> must = matchClauses(query);
        Bson cursor = cursorFilter(query.cursor());
        if (cursor != null) {
            must.add(cursor);
        }
        return combine(must);
    }

    /** The filter without the resume cursor, used to count every match. */
    public static Bson toCountFilter(NodeQuery query) {
        return combine(matchClauses(query));
    }

    static List<Bson> matchClauses(NodeQuery query) {
        List<Bson> must = new ArrayList<>();

        if (!query.classNames().isEmpty()) {
            List<String> classes = new ArrayList<>(new TreeSet<>(query.classNames()));
            must.add(Filters.or(Filters.in(LEGACY_CLASS, classes), Filters.in(NODE_CLASS, classes)));
        }
        if (query.type() != null) {
            must.add(Filters.eq(TYPE, query.type()));
        }
        if (query.searchText() != null) {
            must.add(Filters.regex("label", Pattern.quote(query.searchText()), "i"));
        }
        if (!query.categories().isEmpty()) {
            must.add(Filters.or(
                    Filters.in("properties.category", query.categories()),
                    Filters.in("metadata.category", query.categories())));
        }
        for (Map.Entry<String, List<String>> attr : query.attributes().entrySet()) {
            String key = attr.getKey();
            List<String> terms = attr.getValue();
            List<Bson> should = new ArrayList<>();
            should.add(Filters.in("metadata.categoryAttributes." + key, terms));
            should.add(Filters.in("metadata." + key, terms));
            should.add(Filters.in("properties." + key, terms));
            if ("dates".equals(key)) {
                should.add(Filters.in("metadata.year", terms));
                should.add(Filters.in("properties.year", terms));
            }
            must.add(Filters.or(should));
        }
        if (!query.firstSeenYears().isEmpty()) {
            must.add(Filters.in("metadata.temporal.first_seen_year", yearValues(query.firstSeenYears())));
        }
        if (!query.lastArchivedYears().isEmpty()) {
            must.add(Filters.in("metadata.temporal.last_archived_year", yearValues(query.lastArchivedYears())));
        }
        if (query.minAgeDays() != null) {
            must.add(Filters.gte("metadata.temporal.age_days", query.minAgeDays()));
        }
        if (query.hasPins()) {
            List<Bson> should = new ArrayList<>();
            if (!query.typePins().isEmpty()) {
                should.add(Filters.in(TYPE, query.typePins()));
            }
            if (!query.nodePins().isEmpty()) {
                should.add(Filters.in(EMBEDDED_EDGES + "." + TARGET_ID, query.nodePins()));
                should.add(Filters.in(NODE_ID, query.nodePins()));
            }
            must.add(Filters.or(should));
        }
        return must;
    }

    /**
     * Resumes strictly after the cursor position in (updated_at desc, id desc) order.
     * Nodes with a null or missing {@code updated_at} sort after every dated node, so a
     * dated cursor keeps them reachable and an undated cursor only walks them by id.
     */
    static Bson cursorFilter(PageCursor cursor) {
        if (cursor == null || !cursor.isComplete()) {
            return null;
        }
        Bson undated = Filters.eq(UPDATED_AT_PATH, null);
        if (cursor.isUndated()) {
            return Filters.and(undated, Filters.lt(NODE_ID, cursor.lastNodeId()));
        }
        return Filters.or(
                Filters.lt(UPDATED_AT_PATH, cursor.lastSeenAt()),
                Filters.and(
                        Filters.eq(UPDATED_AT_PATH, cursor.lastSeenAt()),
                        Filters.lt(NODE_ID, cursor.lastNodeId())),
                undated);
    }

    // years are stored as strings by some importers and as numbers by others
    private static List<Object> yearValues(List<String> years) {
        List<Object> values = new ArrayList<>();
        for (String year : years) {
            values.add(year);
            String trimmed = year.trim();
            if (StringUtils.isNumeric(trimmed) && trimmed.length() <= 9) {
                values.add(Integer.valueOf(trimmed));
            }
        }
        return values;
    }

    private static Bson combine(List<Bson> must) {
        if (must.isEmpty()) {
            return Filters.empty();
        }
        return must.size() == 1 ? must.get(0) : Filters.and(must);
    }
}
