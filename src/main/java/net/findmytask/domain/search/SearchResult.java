package net.findmytask.domain.search;

import net.findmytask.model.Task;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A task that matched a query, with its relevance score and highlight spans.
 *
 * <p>Collections are unmodifiable; {@code matchedFields} keeps the order in which
 * fields were scored. The contained {@link Task} is the caller's mutable instance.</p>
 *
 * @param itemId id of the matched task
 * @param task the matched task
 * @param relevanceScore boosted score, always strictly positive
 * @param highlights highlight spans across all matched fields
 * @param matchedFields names of the fields that matched
 */
public record SearchResult(String itemId,
                           Task task,
                           double relevanceScore,
                           List<SearchHighlight> highlights,
                           Set<String> matchedFields) {

    public SearchResult {
        if (!(relevanceScore > 0)) {
            throw new IllegalArgumentException("Relevance score must be positive: " + relevanceScore);
        }
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        matchedFields = matchedFields == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(matchedFields));
    }

    /**
     * Returns the highlights recorded for one field.
     */
    public List<SearchHighlight> highlightsFor(String fieldName) {
        return highlights.stream()
            .filter(highlight -> highlight.fieldName().equals(fieldName))
            .toList();
    }

    public boolean hasMatch(String fieldName) {
        return matchedFields.contains(fieldName);
    }
}
