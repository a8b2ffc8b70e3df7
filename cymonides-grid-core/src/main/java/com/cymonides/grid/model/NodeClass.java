package com.cymonides.grid.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The four top-level node classes. Every class keeps the deprecated spellings that
 * older indexers still write, so queries and readers must accept all of them.
 */
public enum NodeClass {
    SUBJECT("subject", "entity", List.of("entity", "entities")),
    NEXUS("nexus", "query", List.of("query", "queries")),
    NARRATIVE("narrative", "narrative", List.of()),
    LOCATION("location", "source", List.of("source", "sources", "locations"));

    private static final Map<String, NodeClass> BY_NAME = Stream.of(values())
            .flatMap(c -> Stream.concat(Stream.of(c.canonicalName), c.aliases.stream())
                    .map(name -> Map.entry(name, c)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final String canonicalName;
    private final String legacyName;
    private final List<String> aliases;

    NodeClass(String canonicalName, String legacyName, List<String> aliases) {
        this.canonicalName = canonicalName;
        this.legacyName = legacyName;
        this.aliases = aliases;
    }

    public String canonicalName() {
        return canonicalName;
    }

    /** Spelling written to the {@code class} field of stored documents. */
    public String legacyName() {
        return legacyName;
    }

    /** Canonical name followed by every deprecated alias. */
    public Set<String> matchNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(canonicalName);
        names.addAll(aliases);
        return Collections.unmodifiableSet(names);
    }

    public static Optional<NodeClass> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Normalizes any known spelling to the canonical one; unknown values are returned
     * lower-cased and blank values become {@code unknown}.
     */
    public static String normalize(String name) {
        String raw = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) {
            return "unknown";
        }
        return fromName(raw).map(NodeClass::canonicalName).orElse(raw);
    }

    /** Legacy spelling for a node class name, unknown values pass through. */
    public static String legacy(String name) {
        String raw = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) {
            return "unknown";
        }
        return fromName(raw).map(NodeClass::legacyName).orElse(raw);
    }
}
