package net.findmytask.util;

/**
 * Normalization helpers for raw query strings.
 * Keeps the recent-search history and log output consistent about what counts
 * as "the same" query.
 */
public final class SearchQueryUtils {

    private static final int LOG_PREVIEW_LENGTH = 80;

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Trims surrounding whitespace. Returns {@code null} for null or blank input
     * so callers can skip recording empty searches.
     */
    public static String normalize(String query) {
        if (query == null) {
            return null;
        }
        String trimmed = query.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Shortens a query for single-line log output.
     */
    public static String logPreview(String query) {
        if (query == null) {
            return "<null>";
        }
        String singleLine = query.replaceAll("\\s+", " ").trim();
        if (singleLine.length() <= LOG_PREVIEW_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, LOG_PREVIEW_LENGTH) + "...";
    }
}
