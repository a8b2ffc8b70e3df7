package com.cymonides.grid.model;

import java.util.Locale;

public enum EdgeDirection {
    OUTGOING("outgoing"),
    INCOMING("incoming");

    private final String wireName;

    EdgeDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EdgeDirection fromWire(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (EdgeDirection d : values()) {
            if (d.wireName.equals(v)) {
                return d;
            }
        }
        return null;
    }
}
