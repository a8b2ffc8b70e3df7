package com.cymonides.grid.exec;

import java.util.List;

/**
 * What the executed view actually looked at: the rotation, the class filter reported back
 * to the caller, the effective type filter and the raw filter tokens.
 */
public record ViewDescription(String rotation, String classFilter, String typeFilter, List<String> filters) {

    public ViewDescription {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
