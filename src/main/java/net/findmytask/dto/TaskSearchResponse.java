package net.findmytask.dto;

import net.findmytask.domain.search.SearchResult;

import java.util.List;

/**
 * One ranked task plus render-ready snippets for its highlights.
 *
 * @param result the ranked search result
 * @param hits one entry per highlight, in highlight order
 */
public record TaskSearchResponse(SearchResult result, List<SearchHit> hits) {

    public TaskSearchResponse {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }
}
