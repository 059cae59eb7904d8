/**
 * Core task entity searched by the full-text engine
 *
 * Features:
 * - Carries the free-text fields the search engine scores (title, notes, project, context, tags)
 * - Carries the metadata used for boosting (flagged, priority, last-modified timestamp)
 * - Identity is the task id only, so edited copies of a task compare equal
 */
package net.findmytask.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Task {

    @ToString.Include
    @EqualsAndHashCode.Include
    private String id = UUID.randomUUID().toString();
    @ToString.Include
    private String title = "";
    private String notes = "";
    private String project;
    private String context;
    private List<Tag> tags = new ArrayList<>();
    private boolean flagged;
    private Priority priority = Priority.MEDIUM;
    private TaskStatus status = TaskStatus.INBOX;
    private Instant modified = Instant.now();

    public Task(String title) {
        this.title = title;
    }

    /**
     * Tag names joined by a single space, in tag order; empty when the task has no named tags.
     */
    public String getTagNames() {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return tags.stream()
            .filter(Objects::nonNull)
            .map(Tag::name)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "));
    }

    public void setTags(List<Tag> tags) {
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }
}
