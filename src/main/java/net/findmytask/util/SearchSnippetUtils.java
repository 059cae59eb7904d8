package net.findmytask.util;

/**
 * Builds short text previews around a highlighted match.
 */
public final class SearchSnippetUtils {

    public static final int DEFAULT_CONTEXT_CHARS = 50;
    public static final String ELLIPSIS = "...";

    private SearchSnippetUtils() {
        // Utility class
    }

    public static String extractContext(String text, int matchOffset, int matchLength) {
        return extractContext(text, matchOffset, matchLength, DEFAULT_CONTEXT_CHARS);
    }

    /**
     * Returns the slice of {@code text} from {@code contextChars} before the match to
     * {@code contextChars} after it, with {@value #ELLIPSIS} added on each side that was cut.
     *
     * <p>Out-of-range offsets and negative lengths or context sizes are clamped to the
     * text bounds. Positions are UTF-16 code units, matching
     * {@link net.findmytask.domain.search.SearchHighlight}.</p>
     *
     * @param text the full field text; {@code null} yields an empty string
     * @param matchOffset start of the match
     * @param matchLength length of the match
     * @param contextChars characters of context to keep on each side
     * @return the preview string
     */
    public static String extractContext(String text, int matchOffset, int matchLength, int contextChars) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int textLength = text.length();
        int context = Math.max(0, contextChars);
        int matchStart = clamp(matchOffset, 0, textLength);
        int matchEnd = clamp((long) matchStart + Math.max(0, matchLength), matchStart, textLength);

        int previewStart = (int) Math.max(0L, (long) matchStart - context);
        int previewEnd = (int) Math.min(textLength, (long) matchEnd + context);

        StringBuilder preview = new StringBuilder(previewEnd - previewStart + ELLIPSIS.length() * 2);
        if (previewStart > 0) {
            preview.append(ELLIPSIS);
        }
        preview.append(text, previewStart, previewEnd);
        if (previewEnd < textLength) {
            preview.append(ELLIPSIS);
        }
        return preview.toString();
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.min(max, Math.max(min, value));
    }
}
