package com.cymonides.grid.model;

import java.util.List;
import java.util.Map;

public record WatcherResult(String id,
                            String label,
                            int nodeCount,
                            List<String> nodeIds,
                            Map<String, Object> metadata) {

    @SuppressWarnings("unchecked")
    public List<String> monitoredTypes() {
        Object et3 = metadata == null ? null : metadata.get("et3");
        if (et3 instanceof Map<?, ?> m && m.get("monitoredTypes") instanceof List<?> types) {
            return (List<String>) types;
        }
        return null;
    }
}
