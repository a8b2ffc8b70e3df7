package com.cymonides.grid.syntax;

/**
 * A {@code dim:value} clause. {@code raw} keeps the token as typed (with any leading
 * {@code ##}); {@code kind} is resolved from the dimension at parse time.
 */
public record FilterClause(String dimension, String value, String raw, FilterDimension kind) {

    public static FilterClause of(String dimension, String value, String raw) {
        return new FilterClause(dimension, value, raw, FilterDimension.resolve(dimension));
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }
}
