package net.findmytask.service;

import net.findmytask.model.Task;

import java.util.List;

/**
 * Supplies the tasks a search runs over. The record store behind it is owned by the host application.
 */
public interface TaskSource {

    /**
     * Returns a point-in-time snapshot of all searchable tasks.
     */
    List<Task> findAll();
}
