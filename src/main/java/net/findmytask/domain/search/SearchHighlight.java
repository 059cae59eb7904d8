package net.findmytask.domain.search;

/**
 * A matched region inside one field of a task.
 *
 * <p>{@code offset} and {@code length} are UTF-16 code unit positions (Java {@link String}
 * indices) into the original-cased field text, so {@code text.substring(offset, offset + length)}
 * yields {@code matchedText}.</p>
 *
 * @param fieldName searchable field the match belongs to (e.g. {@code title})
 * @param offset start index in the original text, zero or greater
 * @param length number of code units matched, greater than zero
 * @param matchedText the matched slice exactly as it appears in the original text
 */
public record SearchHighlight(String fieldName, int offset, int length, String matchedText) {

    public SearchHighlight {
        if (offset < 0) {
            throw new IllegalArgumentException("Highlight offset must be non-negative: " + offset);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("Highlight length must be positive: " + length);
        }
    }

    /** Exclusive end index of the highlighted region. */
    public int end() {
        return offset + length;
    }
}
