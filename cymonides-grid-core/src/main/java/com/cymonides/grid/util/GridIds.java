package com.cymonides.grid.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic ids for edges and the nodes the grid creates itself.
 */
public final class GridIds {

    public static final String TAG_PREFIX = "tag:";
    public static final String WATCHER_PREFIX = "watcher_ent_";

    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]+");

    private GridIds() {
    }

    /**
     * Edge id shared by both sides of a relationship.
     */
    public static String edgeId(String fromId, String toId, String relation) {
        return calculateMD5(fromId + ":" + toId + ":" + relation);
    }

    /**
     * Tag id for a label: "Needs Review", "needs review" and " needs-review " all map to
     * {@code tag:needs-review}.
     */
    public static String tagId(String label) {
        return TAG_PREFIX + slugify(label);
    }

    public static String watcherId(String label, String createdAt) {
        return WATCHER_PREFIX + calculateMD5(label + createdAt).substring(0, 12);
    }

    public static String slugify(String value) {
        String lower = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        String slug = NON_SLUG.matcher(lower).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    public static String calculateMD5(String input) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            byte[] array = messageDigest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(array);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 calculation failed", e);
        }
    }
}
