package net.findmytask.dto;

import net.findmytask.domain.search.SearchHighlight;

/**
 * A highlight paired with a ready-to-render preview of its surrounding text.
 *
 * @param highlight the matched span
 * @param snippet field text around the match, with ellipses where it was cut
 */
public record SearchHit(SearchHighlight highlight, String snippet) {
}
