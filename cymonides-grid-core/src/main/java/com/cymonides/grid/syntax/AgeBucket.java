package com.cymonides.grid.syntax;

import java.util.Optional;

public enum AgeBucket {
    TEN_YEARS("10y+", 3650),
    FIVE_YEARS("5y+", 1825),
    ONE_YEAR("1y+", 365),
    NINETY_DAYS("90d+", 90),
    THIRTY_DAYS("30d+", 30),
    RECENT("0-29d", 0);

    private final String label;
    private final int minDays;

    AgeBucket(String label, int minDays) {
        this.label = label;
        this.minDays = minDays;
    }

    public String label() {
        return label;
    }

    public int minDays() {
        return minDays;
    }

    public static Optional<AgeBucket> fromLabel(String label) {
        for (AgeBucket b : values()) {
            if (b.label.equals(label)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }
}
