package net.findmytask.domain.search;

import java.util.List;
import java.util.Set;

/**
 * Partial result of matching one field against a query.
 *
 * @param score weighted score contributed by the field
 * @param highlights spans found in the field, in term order then position order
 * @param matchedTermIndexes positions in {@link SearchQuery#terms()} of the positive terms that matched
 */
public record FieldMatch(double score, List<SearchHighlight> highlights, Set<Integer> matchedTermIndexes) {

    public FieldMatch {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        matchedTermIndexes = matchedTermIndexes == null ? Set.of() : Set.copyOf(matchedTermIndexes);
    }
}
