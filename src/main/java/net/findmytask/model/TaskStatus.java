package net.findmytask.model;

/**
 * Workflow state of a task. Search does not filter on status; it is carried for callers.
 */
public enum TaskStatus {
    INBOX,
    NEXT_ACTION,
    WAITING,
    SOMEDAY,
    COMPLETED
}
