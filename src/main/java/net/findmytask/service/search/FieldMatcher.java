package net.findmytask.service.search;

import net.findmytask.domain.search.FieldMatch;
import net.findmytask.domain.search.SearchHighlight;
import net.findmytask.domain.search.SearchQuery;
import net.findmytask.domain.search.SearchTerm;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a single text field against a parsed query.
 *
 * <p>Matching is case-insensitive substring search. Exact (quoted) terms count their first
 * occurrence at double weight; plain terms highlight every non-overlapping occurrence and
 * score once, with a bonus when the field starts with the term. A negated term that occurs
 * anywhere in the field disqualifies the whole field.</p>
 *
 * <p>Operator rules are evaluated per field: under both AND and OR the field matches
 * when at least one term occurred in it.</p>
 */
@Component
public class FieldMatcher {

    static final double EXACT_MULTIPLIER = 2.0;
    static final double PREFIX_MULTIPLIER = 1.5;
    static final double SUBSTRING_MULTIPLIER = 1.0;

    public FieldMatcher() {
        // Stateless; safe to share across scoring threads.
    }

    /**
     * @param text field text in its original case; {@code null} never matches
     * @param query parsed query
     * @param weight field weight multiplied into every term score
     * @param fieldName name recorded on each highlight
     * @return the field's score and highlights, or empty when the field does not match
     */
    public Optional<FieldMatch> matchField(String text, SearchQuery query, double weight, String fieldName) {
        if (text == null || text.isEmpty() || query == null || query.isEmpty()) {
            return Optional.empty();
        }

        CaseInsensitiveText haystack = new CaseInsensitiveText(text);
        List<SearchTerm> terms = query.terms();
        List<SearchHighlight> highlights = new ArrayList<>();
        Set<Integer> matchedTerms = new LinkedHashSet<>();
        double score = 0;
        boolean hasMatch = false;

        for (int termIndex = 0; termIndex < terms.size(); termIndex++) {
            SearchTerm term = terms.get(termIndex);
            String needle = term.text().toLowerCase(Locale.ROOT);

            if (term.exact()) {
                int found = haystack.indexOf(needle, 0);
                if (found < 0) {
                    continue;
                }
                if (term.negated()) {
                    return Optional.empty();
                }
                hasMatch = true;
                matchedTerms.add(termIndex);
                score += weight * EXACT_MULTIPLIER;
                highlights.add(haystack.highlight(fieldName, found, needle));
                continue;
            }

            int found = haystack.indexOf(needle, 0);
            if (found < 0) {
                continue;
            }
            if (term.negated()) {
                return Optional.empty();
            }
            hasMatch = true;
            matchedTerms.add(termIndex);
            score += weight * (haystack.startsWith(needle) ? PREFIX_MULTIPLIER : SUBSTRING_MULTIPLIER);

            while (found >= 0) {
                SearchHighlight highlight = haystack.highlight(fieldName, found, needle);
                highlights.add(highlight);
                found = haystack.indexOf(needle, highlight.end());
            }
        }

        // AND with positive terms and OR both require at least one occurrence in this field;
        // a query of only negated terms never produces a match on its own.
        if (!hasMatch) {
            return Optional.empty();
        }
        return Optional.of(new FieldMatch(score, highlights, matchedTerms));
    }

    /**
     * Case-insensitive view of a field that reports positions in the original text.
     *
     * <p>Searches run against a lowercased copy. When lowercasing keeps the text length,
     * positions in the copy are positions in the original. Otherwise (e.g. dotted capital I,
     * which lowercases to two chars) the copy is built one code point at a time and index
     * maps translate between the two.</p>
     */
    private static final class CaseInsensitiveText {
        private final String original;
        private final String lowered;
        // null when lowered and original positions coincide
        private final int[] loweredIndexOf;
        private final int[] originalStartOf;
        private final int[] originalEndOf;

        private CaseInsensitiveText(String original) {
            this.original = original;
            String whole = original.toLowerCase(Locale.ROOT);
            if (whole.length() == original.length()) {
                this.lowered = whole;
                this.loweredIndexOf = null;
                this.originalStartOf = null;
                this.originalEndOf = null;
                return;
            }

            StringBuilder folded = new StringBuilder(whole.length());
            int[] loweredIndex = new int[original.length() + 1];
            List<int[]> spans = new ArrayList<>();
            int i = 0;
            while (i < original.length()) {
                int next = original.offsetByCodePoints(i, 1);
                for (int j = i; j < next; j++) {
                    loweredIndex[j] = folded.length();
                }
                int before = folded.length();
                folded.append(original.substring(i, next).toLowerCase(Locale.ROOT));
                spans.add(new int[] {before, folded.length(), i, next});
                i = next;
            }
            loweredIndex[original.length()] = folded.length();

            this.lowered = folded.toString();
            this.loweredIndexOf = loweredIndex;
            this.originalStartOf = new int[lowered.length()];
            this.originalEndOf = new int[lowered.length()];
            for (int[] span : spans) {
                for (int k = span[0]; k < span[1]; k++) {
                    originalStartOf[k] = span[2];
                    originalEndOf[k] = span[3];
                }
            }
        }

        /**
         * @param needle lowercased term
         * @param from position in the original text to search from
         * @return position of the match in the lowercased copy, or -1
         */
        private int indexOf(String needle, int from) {
            if (from >= original.length()) {
                return -1;
            }
            return lowered.indexOf(needle, loweredIndexOf == null ? from : loweredIndexOf[from]);
        }

        private boolean startsWith(String needle) {
            return lowered.startsWith(needle);
        }

        private SearchHighlight highlight(String fieldName, int loweredOffset, String needle) {
            int loweredEnd = loweredOffset + needle.length();
            int start = loweredIndexOf == null ? loweredOffset : originalStartOf[loweredOffset];
            int end = loweredIndexOf == null ? loweredEnd : originalEndOf[loweredEnd - 1];
            return new SearchHighlight(fieldName, start, end - start, original.substring(start, end));
        }
    }
}
