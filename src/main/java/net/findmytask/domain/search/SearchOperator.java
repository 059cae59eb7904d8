package net.findmytask.domain.search;

/**
 * Boolean operator applied to every term of a query. A query carries exactly one.
 */
public enum SearchOperator {
    AND,
    OR
}
