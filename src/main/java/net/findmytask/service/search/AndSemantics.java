package net.findmytask.service.search;

/**
 * How an AND query is evaluated across the fields of a task.
 */
public enum AndSemantics {
    /**
     * Each field is matched on its own and any field with at least one occurring term
     * contributes. A task can match {@code a AND b} with {@code a} in the title and no {@code b} anywhere.
     */
    PER_FIELD,
    /**
     * On top of the per-field rules, every non-negated term of an AND query must occur
     * in at least one field of the task.
     */
    ITEM
}
