package net.findmytask.service.search;

import net.findmytask.model.Task;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Task attributes covered by full-text search, in scoring order, with their fixed weights.
 */
public enum SearchableField {
    // Declaration order is scoring order; matchedFields and highlights follow it.
    TITLE("title", 10.0, Task::getTitle),
    PROJECT("project", 5.0, Task::getProject),
    CONTEXT("context", 3.0, Task::getContext),
    NOTES("notes", 1.0, Task::getNotes),
    TAGS("tags", 4.0, Task::getTagNames);

    private final String fieldName;
    private final double weight;
    private final Function<Task, String> extractor;

    SearchableField(String fieldName, double weight, Function<Task, String> extractor) {
        this.fieldName = fieldName;
        this.weight = weight;
        this.extractor = extractor;
    }

    public String fieldName() {
        return fieldName;
    }

    public double weight() {
        return weight;
    }

    /**
     * Returns the field text for a task, or {@code null} when the field is absent or empty.
     */
    public String textOf(Task task) {
        String value = extractor.apply(task);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Looks up a field by the name recorded on highlights (e.g. {@code "title"}).
     */
    public static Optional<SearchableField> fromFieldName(String fieldName) {
        return Arrays.stream(values())
            .filter(field -> field.fieldName.equals(fieldName))
            .findFirst();
    }
}
