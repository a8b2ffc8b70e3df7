package com.cymonides.grid.syntax;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A spreadsheet-style address into a composed view: a bare column ({@code C}), a bare
 * row ({@code 3}), a single cell ({@code 3A}) or an inclusive row range with a column
 * ({@code 3-7A}). Rows are 1-based.
 */
public record CellReference(Kind kind, Column column, Integer row, Integer rowEnd) {

    public enum Kind { CELL, RANGE, COLUMN, ROW }

    /**
     * A and B both address the row's primary node; C addresses every related node of the row.
     */
    public enum Column {
        A, B, C;

        public boolean isPrimary() {
            return this == A || this == B;
        }
    }

    private static final Pattern RANGE = Pattern.compile("^(\\d+)-(\\d+)([ABC])$");
    private static final Pattern CELL = Pattern.compile("^(\\d+)([ABC])$");
    private static final Pattern COLUMN = Pattern.compile("^[ABC]$");
    private static final Pattern ROW = Pattern.compile("^\\d+$");

    public static CellReference column(Column column) {
        return new CellReference(Kind.COLUMN, column, null, null);
    }

    public static CellReference row(int row) {
        return new CellReference(Kind.ROW, null, row, null);
    }

    public static CellReference cell(int row, Column column) {
        return new CellReference(Kind.CELL, column, row, null);
    }

    public static CellReference range(int from, int to, Column column) {
        return new CellReference(Kind.RANGE, column, from, to);
    }

    /**
     * Parses one token. Anything that is not an address (or whose row number does not fit
     * an int) yields empty.
     */
    public static Optional<CellReference> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String t = token.trim().toUpperCase(Locale.ROOT);
        if (t.isEmpty()) {
            return Optional.empty();
        }
        try {
            Matcher m = RANGE.matcher(t);
            if (m.matches()) {
                return Optional.of(range(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                        Column.valueOf(m.group(3))));
            }
            m = CELL.matcher(t);
            if (m.matches()) {
                return Optional.of(cell(Integer.parseInt(m.group(1)), Column.valueOf(m.group(2))));
            }
            if (COLUMN.matcher(t).matches()) {
                return Optional.of(column(Column.valueOf(t)));
            }
            if (ROW.matcher(t).matches()) {
                return Optional.of(row(Integer.parseInt(t)));
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
