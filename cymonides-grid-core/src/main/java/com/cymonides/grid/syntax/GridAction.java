package com.cymonides.grid.syntax;

/**
 * One action following {@code =>}. {@code label} is the tag or watcher label,
 * {@code typeHint} the watcher's monitored type and {@code raw} the action text as typed.
 */
public record GridAction(Kind kind, String label, String typeHint, String raw) {

    public enum Kind { TAG_ADD, TAG_REMOVE, WATCHER, UNRECOGNIZED }

    public static GridAction tagAdd(String label, String raw) {
        return new GridAction(Kind.TAG_ADD, label, null, raw);
    }

    public static GridAction tagRemove(String label, String raw) {
        return new GridAction(Kind.TAG_REMOVE, label, null, raw);
    }

    public static GridAction watcher(String label, String typeHint, String raw) {
        return new GridAction(Kind.WATCHER, label, typeHint, raw);
    }

    public static GridAction unrecognized(String raw) {
        return new GridAction(Kind.UNRECOGNIZED, null, null, raw);
    }
}
