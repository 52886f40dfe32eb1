package openauth.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flattens hierarchical keys into a single sortable string and back.
 *
 * <p>Segments are joined with {@link #SEPARATOR} ({@code U+001F}, unit separator). Because the
 * separator sorts below every printable character, keys sharing a leading segment sequence stay
 * adjacent under {@link String#compareTo(String)}.
 *
 * <p>{@link #join(List)} rejects segments containing the separator. Callers holding untrusted
 * identifiers (authorization codes, client IDs, subjects) run them through
 * {@link #sanitize(String)} first, which strips the separator instead. Stripping is lossy: two
 * identifiers that differ only by separator characters map to the same key.
 */
public final class KeyCodec {

    public static final char SEPARATOR = '\u001f';

    private static final String SEPARATOR_STRING = String.valueOf(SEPARATOR);

    private KeyCodec() {}

    /**
     * Join segments into a flat key.
     *
     * @param segments ordered key segments
     * @return the flat key, or an empty string for an empty segment list
     * @throws IllegalArgumentException if a segment contains the separator, or the list is a
     *                                  single empty segment (not distinguishable from no segments)
     */
    public static String join(List<String> segments) {
        if (segments.size() == 1 && segments.get(0).isEmpty()) {
            throw new IllegalArgumentException("A key cannot consist of a single empty segment");
        }
        for (String segment : segments) {
            if (segment.indexOf(SEPARATOR) >= 0) {
                throw new IllegalArgumentException("Key segment contains the reserved separator: " + printable(segment));
            }
        }
        return String.join(SEPARATOR_STRING, segments);
    }

    /**
     * Split a flat key produced by {@link #join(List)} back into its segments.
     *
     * @param flatKey the flat key
     * @return the segments; empty for an empty key
     */
    public static List<String> split(String flatKey) {
        if (flatKey.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(flatKey.split(SEPARATOR_STRING, -1)));
    }

    /**
     * Remove every separator character from a segment.
     */
    public static String sanitize(String segment) {
        return segment.replace(SEPARATOR_STRING, "");
    }

    /**
     * Sanitize every segment of a key.
     */
    public static List<String> sanitize(List<String> segments) {
        return segments.stream().map(KeyCodec::sanitize).toList();
    }

    /**
     * Whether {@code flatKey} lies at or under {@code flatPrefix} on a segment boundary.
     *
     * <p>{@code ["oauth:refresh", "alice"]} covers {@code ["oauth:refresh", "alice", "t1"]} but
     * not {@code ["oauth:refresh", "alice2", "t1"]}. An empty prefix covers every key.
     */
    public static boolean hasPrefix(String flatKey, String flatPrefix) {
        if (flatPrefix.isEmpty()) {
            return true;
        }
        if (!flatKey.startsWith(flatPrefix)) {
            return false;
        }
        return flatKey.length() == flatPrefix.length() || flatKey.charAt(flatPrefix.length()) == SEPARATOR;
    }

    private static String printable(String segment) {
        return segment.replace(SEPARATOR_STRING, "\\u001f");
    }
}
