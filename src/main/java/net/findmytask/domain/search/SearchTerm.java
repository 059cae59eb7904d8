package net.findmytask.domain.search;

/**
 * One token or quoted phrase extracted from a raw query string.
 *
 * @param text the text to look for, never empty
 * @param exact true when the term was quoted; matched once as a literal phrase with double weight
 * @param negated true when the term was preceded by {@code NOT}; its presence disqualifies a field
 */
public record SearchTerm(String text, boolean exact, boolean negated) {

    public SearchTerm {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Search term text must not be empty");
        }
    }

    /** Creates a plain, non-negated substring term. */
    public static SearchTerm of(String text) {
        return new SearchTerm(text, false, false);
    }
}
