package net.findmytask.model;

/**
 * Named label attached to a task.
 *
 * @param name display name, also the searchable text
 * @param color hex color used by renderers (may be null)
 */
public record Tag(String name, String color) {

    public Tag(String name) {
        this(name, null);
    }
}
