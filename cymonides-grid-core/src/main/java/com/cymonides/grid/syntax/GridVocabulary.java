package com.cymonides.grid.syntax;

import com.cymonides.grid.model.NodeClass;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed alias tables of the grid language. Class aliases and type aliases are disjoint.
 */
public final class GridVocabulary {

    private GridVocabulary() {
    }

    static final Map<String, NodeClass> CLASS_ALIASES = Map.ofEntries(
            Map.entry("@subject", NodeClass.SUBJECT),
            Map.entry("@nexus", NodeClass.NEXUS),
            Map.entry("@narrative", NodeClass.NARRATIVE),
            Map.entry("@location", NodeClass.LOCATION),
            Map.entry("@s", NodeClass.SUBJECT),
            Map.entry("@x", NodeClass.NEXUS),
            Map.entry("@n", NodeClass.NARRATIVE),
            Map.entry("@l", NodeClass.LOCATION));

    static final Map<String, String> TYPE_ALIASES = Map.ofEntries(
            Map.entry("@person", "person"),
            Map.entry("@company", "company"),
            Map.entry("@p", "person"),
            Map.entry("@c", "company"),
            Map.entry("@query", "query"),
            Map.entry("@source", "source"),
            Map.entry("@q", "query"),
            Map.entry("@src", "source"),
            Map.entry("@email", "email"),
            Map.entry("@phone", "phone"),
            Map.entry("@username", "username"),
            Map.entry("@e", "email"),
            Map.entry("@t", "phone"),
            Map.entry("@u", "username"),
            Map.entry("@address", "address"),
            Map.entry("@jurisdiction", "jurisdiction"),
            Map.entry("@domain", "domain"),
            Map.entry("@addr", "address"),
            Map.entry("@dom", "domain"),
            Map.entry("@document", "document"),
            Map.entry("@note", "note"),
            Map.entry("@doc", "document"));

    // E is an alias of S
    static final Map<Character, NodeClass> ROTATIONS = Map.of(
            'S', NodeClass.SUBJECT,
            'E', NodeClass.SUBJECT,
            'X', NodeClass.NEXUS,
            'N', NodeClass.NARRATIVE,
            'L', NodeClass.LOCATION);

    static final Map<Character, String> WATCHER_TYPE_HINTS = Map.of(
            'P', "person",
            'S', "person",
            'C', "company");

    public static Optional<NodeClass> classAlias(String token) {
        return Optional.ofNullable(CLASS_ALIASES.get(token.toLowerCase(Locale.ROOT)));
    }

    public static Optional<String> typeAlias(String token) {
        return Optional.ofNullable(TYPE_ALIASES.get(token.toLowerCase(Locale.ROOT)));
    }

    public static Optional<NodeClass> rotation(char letter) {
        return Optional.ofNullable(ROTATIONS.get(Character.toUpperCase(letter)));
    }

    public static Optional<String> watcherTypeHint(char letter) {
        return Optional.ofNullable(WATCHER_TYPE_HINTS.get(Character.toUpperCase(letter)));
    }
}
