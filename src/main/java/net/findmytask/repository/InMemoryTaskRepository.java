package net.findmytask.repository;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.model.Task;
import net.findmytask.service.TaskSource;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process task store, used when the host application does not register its own {@link TaskSource}.
 * Preserves insertion order so ranking ties are reproducible.
 */
@Repository
@Slf4j
public class InMemoryTaskRepository implements TaskSource {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    @Override
    public synchronized List<Task> findAll() {
        return order.stream().map(tasks::get).toList();
    }

    public synchronized void save(Task task) {
        if (task == null || task.getId() == null) {
            log.warn("Ignoring task without an id");
            return;
        }
        if (tasks.put(task.getId(), task) == null) {
            order.add(task.getId());
        }
    }

    public synchronized void saveAll(List<Task> batch) {
        batch.forEach(this::save);
    }

    public Optional<Task> findById(String id) {
        return Optional.ofNullable(id).map(tasks::get);
    }

    public synchronized boolean delete(String id) {
        if (id == null || tasks.remove(id) == null) {
            return false;
        }
        order.remove(id);
        return true;
    }

    public synchronized void clear() {
        tasks.clear();
        order.clear();
    }
}
