package net.findmytask.domain.search;

import java.util.List;

/**
 * Parsed form of a raw query string.
 *
 * <p>Terms keep input order. The term list is copied on construction and never
 * mutated afterwards; a query with no terms matches nothing.</p>
 *
 * @param terms ordered, unmodifiable search terms
 * @param operator the single operator applied to the whole query
 */
public record SearchQuery(List<SearchTerm> terms, SearchOperator operator) {

    private static final SearchQuery EMPTY = new SearchQuery(List.of(), SearchOperator.AND);

    public SearchQuery {
        terms = terms == null ? List.of() : List.copyOf(terms);
        operator = operator == null ? SearchOperator.AND : operator;
    }

    /** The canonical "match nothing" query. */
    public static SearchQuery empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
