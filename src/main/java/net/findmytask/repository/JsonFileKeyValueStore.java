package net.findmytask.repository;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.exception.KeyValueStoreException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link KeyValueStore} persisted as a single JSON object file.
 *
 * <p>Every write re-reads the file, applies the change and replaces the file through a
 * temporary sibling, so readers never observe a half-written document. Access is
 * serialized per instance.</p>
 */
@Slf4j
public class JsonFileKeyValueStore implements KeyValueStore {

    private static final TypeReference<LinkedHashMap<String, List<String>>> DOCUMENT_TYPE =
        new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileKeyValueStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<List<String>> getStringList(String key) {
        return Optional.ofNullable(readDocument(key).get(key)).map(List::copyOf);
    }

    @Override
    public synchronized void putStringList(String key, List<String> values) {
        Map<String, List<String>> document = readDocument(key);
        document.put(key, List.copyOf(values));
        writeDocument(key, document);
    }

    @Override
    public synchronized void remove(String key) {
        Map<String, List<String>> document = readDocument(key);
        if (document.remove(key) != null) {
            writeDocument(key, document);
        }
    }

    private Map<String, List<String>> readDocument(String key) {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return new LinkedHashMap<>();
            }
            Map<String, List<String>> document = objectMapper.readValue(json, DOCUMENT_TYPE);
            return document == null ? new LinkedHashMap<>() : new LinkedHashMap<>(document);
        } catch (IOException ex) {
            throw new KeyValueStoreException("Failed to read key-value store " + file, key, ex);
        } catch (JacksonException ex) {
            throw new KeyValueStoreException("Key-value store " + file + " is not valid JSON", key, ex);
        }
    }

    private void writeDocument(String key, Map<String, List<String>> document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
                Files.writeString(temp, json, StandardCharsets.UTF_8);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new KeyValueStoreException("Failed to write key-value store " + file, key, ex);
        } catch (JacksonException ex) {
            throw new KeyValueStoreException("Failed to serialize key-value store " + file, key, ex);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}; falling back to plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
