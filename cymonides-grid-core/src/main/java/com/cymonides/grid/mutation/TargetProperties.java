package com.cymonides.grid.mutation;

import com.cymonides.grid.model.GridNode;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the handful of node fields copied into the other side's embedded edge.
 */
final class TargetProperties {

    static final int MAX_SNIPPET = 500;

    private TargetProperties() {
    }

    static Map<String, Object> pick(GridNode node) {
        Map<String, Object> meta = node.getMetadata() != null && !node.getMetadata().isEmpty()
                ? node.getMetadata()
                : node.getProperties() != null ? node.getProperties() : Map.of();

        String url = firstText(meta.get("url"), node.getUrl(), node.getCanonicalValue());
        String snippet = firstText(node.getSnippet(), meta.get("snippet"), meta.get("description"));
        Object attrs = meta.get("categoryAttributes");
        Object attrFiletype = attrs instanceof Map<?, ?> m ? m.get("filetype") : null;
        String filetype = firstText(meta.get("filetype"), attrFiletype);
        String country = firstText(meta.get("country"), meta.get("newsCountry"));
        String language = firstText(meta.get("language"), meta.get("newsLanguage"));
        String color = firstText(meta.get("tagColor"), meta.get("color"));

        Map<String, Object> props = new LinkedHashMap<>();
        putText(props, "url", url);
        putText(props, "domain", text(meta.get("domain")));
        putText(props, "title", text(meta.get("title")));
        if (StringUtils.isNotBlank(snippet)) {
            props.put("snippet", StringUtils.left(snippet, MAX_SNIPPET));
        }
        putText(props, "category", text(meta.get("category")));
        if (StringUtils.isNotBlank(filetype)) {
            props.put("filetype", filetype.toLowerCase(Locale.ROOT));
        }
        putText(props, "country", country);
        putText(props, "language", language);
        if (StringUtils.isNotBlank(color)) {
            props.put("color", color);
            props.put("tagColor", color);
        }
        return props;
    }

    private static void putText(Map<String, Object> props, String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            props.put(key, value);
        }
    }

    private static String text(Object value) {
        return value instanceof String s ? s : null;
    }

    private static String firstText(Object... candidates) {
        for (Object c : candidates) {
            if (c instanceof String s && !s.isEmpty()) {
                return s;
            }
        }
        return null;
    }
}
