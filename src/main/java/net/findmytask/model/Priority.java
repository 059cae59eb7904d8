package net.findmytask.model;

/**
 * Task priority level. Medium is the default for new tasks.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
