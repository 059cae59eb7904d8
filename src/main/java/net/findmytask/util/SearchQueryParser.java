package net.findmytask.util;

import net.findmytask.domain.search.SearchOperator;
import net.findmytask.domain.search.SearchQuery;
import net.findmytask.domain.search.SearchTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the search box language into a {@link SearchQuery}.
 *
 * <p>Supported syntax:</p>
 * <ul>
 *   <li>{@code urgent task} - two substring terms joined by AND</li>
 *   <li>{@code bug OR feature} - switches the whole query to OR</li>
 *   <li>{@code report NOT draft} - negates the next term only</li>
 *   <li>{@code "exact phrase"} - a quoted literal phrase</li>
 * </ul>
 *
 * <p>The last {@code AND}/{@code OR} keyword seen wins for the whole query. Parsing is
 * total: any input, including {@code null}, yields a query, possibly with no terms.</p>
 */
public final class SearchQueryParser {

    private static final char QUOTE = '"';
    private static final String KEYWORD_AND = "AND";
    private static final String KEYWORD_OR = "OR";
    private static final String KEYWORD_NOT = "NOT";

    private SearchQueryParser() {
        // Utility class
    }

    public static SearchQuery parse(String raw) {
        if (raw == null || raw.chars().allMatch(SearchQueryParser::isSeparator)) {
            return SearchQuery.empty();
        }

        ParseState state = new ParseState();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == QUOTE) {
                if (state.inQuotes) {
                    state.flushTerm(true);
                    state.inQuotes = false;
                } else {
                    state.flushTerm(false);
                    state.inQuotes = true;
                }
            } else if (!state.inQuotes && isSeparator(c)) {
                state.flushToken();
            } else {
                state.buffer.append(c);
            }
        }

        if (state.inQuotes) {
            // unterminated quote runs to end of input
            state.flushTerm(true);
        } else {
            state.flushToken();
        }

        if (state.terms.isEmpty()) {
            return SearchQuery.empty();
        }
        return new SearchQuery(state.terms, state.operator);
    }

    /** Unicode white space, including no-break spaces that {@link Character#isWhitespace} excludes. */
    private static boolean isSeparator(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static final class ParseState {
        private final List<SearchTerm> terms = new ArrayList<>();
        private final StringBuilder buffer = new StringBuilder();
        private SearchOperator operator = SearchOperator.AND;
        private boolean inQuotes;
        private boolean pendingNegation;

        /** Unquoted token boundary: operator keywords are consumed, anything else is a term. */
        private void flushToken() {
            if (buffer.length() == 0) {
                return;
            }
            String token = buffer.toString();
            switch (token.toUpperCase(Locale.ROOT)) {
                case KEYWORD_AND -> operator = SearchOperator.AND;
                case KEYWORD_OR -> operator = SearchOperator.OR;
                case KEYWORD_NOT -> pendingNegation = true;
                default -> {
                    terms.add(new SearchTerm(token, false, pendingNegation));
                    pendingNegation = false;
                }
            }
            buffer.setLength(0);
        }

        private void flushTerm(boolean exact) {
            if (buffer.length() == 0) {
                return;
            }
            terms.add(new SearchTerm(buffer.toString(), exact, pendingNegation));
            pendingNegation = false;
            buffer.setLength(0);
        }
    }
}
