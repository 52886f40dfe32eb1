package openauth.adapter.out.storage.memory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import openauth.core.model.storage.ScanEntry;
import openauth.core.model.storage.StoreEntry;
import openauth.core.port.out.KeyValueStorage;
import openauth.core.util.KeyCodec;
import openauth.spi.StoragePersistenceException;

/**
 * In-memory ordered key-value storage with optional file persistence.
 *
 * <p>Entries live in a {@link TreeMap} keyed by flat key, so iteration is always in ascending
 * key order. Expiry is lazy: {@link #get(List)} deletes an expired entry it finds, while
 * {@link #scan(List)} only skips them.
 *
 * <p>With a persistence file, the whole store is written as JSON after every mutation:
 * <pre>
 * [["oauth:code\u001fabc", {"value": {...}, "expiry": 1700000000000}], ...]
 * </pre>
 * The file is written to a temporary sibling and moved into place. Several processes sharing
 * one file overwrite each other's changes; the last save wins.
 *
 * <p><strong>Warning:</strong> Intended for development and single-instance deployments.
 */
public class MemoryKeyValueStorage implements KeyValueStorage {

    private static final Logger LOG = Logger.getLogger(MemoryKeyValueStorage.class);

    private final TreeMap<String, StoreEntry> store = new TreeMap<>();
    private final Object lock = new Object();
    private final Optional<Path> persist;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Create a memory-only store.
     */
    public MemoryKeyValueStorage(ObjectMapper objectMapper) {
        this(Optional.empty(), objectMapper, Clock.systemUTC());
    }

    /**
     * Create a store, loading existing state from {@code persist} if the file exists.
     *
     * @param persist      persistence file, or empty for memory-only
     * @param objectMapper mapper used for the persisted JSON
     * @param clock        clock used for expiry checks
     * @throws StoragePersistenceException if the file exists but cannot be read or parsed
     */
    public MemoryKeyValueStorage(Optional<Path> persist, ObjectMapper objectMapper, Clock clock) {
        this.persist = persist;
        this.objectMapper = objectMapper;
        this.clock = clock;
        persist.ifPresent(this::load);
    }

    @Override
    public Uni<Optional<Object>> get(List<String> key) {
        return Uni.createFrom().item(() -> {
            final var flatKey = KeyCodec.join(key);
            synchronized (lock) {
                final var entry = store.get(flatKey);
                if (entry == null) {
                    return Optional.empty();
                }
                if (entry.isExpired(clock.instant())) {
                    LOG.debugf("Evicting expired entry %s", printable(flatKey));
                    store.remove(flatKey);
                    save();
                    return Optional.empty();
                }
                return Optional.ofNullable(entry.value());
            }
        });
    }

    @Override
    public Uni<Void> set(List<String> key, Object value, Instant expiry) {
        return Uni.createFrom().item(() -> {
            final var flatKey = KeyCodec.join(key);
            // Detach from the caller's object graph so later mutation cannot leak in
            final var copy = objectMapper.convertValue(value, Object.class);
            synchronized (lock) {
                store.put(flatKey, StoreEntry.of(copy, expiry));
                save();
            }
            LOG.debugf("Stored %s with expiry %s", printable(flatKey), expiry);
            return null;
        });
    }

    @Override
    public Uni<Void> remove(List<String> key) {
        return Uni.createFrom().item(() -> {
            final var flatKey = KeyCodec.join(key);
            synchronized (lock) {
                if (store.remove(flatKey) != null) {
                    save();
                    LOG.debugf("Removed %s", printable(flatKey));
                }
            }
            return null;
        });
    }

    @Override
    public Multi<ScanEntry> scan(List<String> prefix) {
        return Multi.createFrom().deferred(() -> Multi.createFrom().iterable(snapshot(KeyCodec.join(prefix))));
    }

    private List<ScanEntry> snapshot(String flatPrefix) {
        final var now = clock.instant();
        final var matches = new ArrayList<ScanEntry>();
        synchronized (lock) {
            // Keys sharing a string prefix are contiguous, so stop at the first one that does not
            for (Map.Entry<String, StoreEntry> e : store.tailMap(flatPrefix, true).entrySet()) {
                final var flatKey = e.getKey();
                if (!flatKey.startsWith(flatPrefix)) {
                    break;
                }
                if (!KeyCodec.hasPrefix(flatKey, flatPrefix) || e.getValue().isExpired(now)) {
                    continue;
                }
                matches.add(new ScanEntry(KeyCodec.split(flatKey), e.getValue().value()));
            }
        }
        return matches;
    }

    /**
     * Number of stored entries, expired ones included (for testing).
     */
    public int size() {
        synchronized (lock) {
            return store.size();
        }
    }

    /**
     * Flat keys in stored order, expired ones included (for testing).
     */
    public List<String> keys() {
        synchronized (lock) {
            return List.copyOf(store.keySet());
        }
    }

    /**
     * Remove every entry and persist the empty store.
     */
    public void clear() {
        synchronized (lock) {
            store.clear();
            save();
        }
    }

    private void load(Path path) {
        if (!Files.exists(path)) {
            LOG.infof("Persistence file %s does not exist yet, starting empty", path);
            return;
        }
        try {
            if (Files.size(path) == 0) {
                return;
            }
            final var root = objectMapper.readTree(path.toFile());
            if (!root.isArray()) {
                throw new StoragePersistenceException("Persistence file " + path + " is not a JSON array");
            }
            for (JsonNode pair : (ArrayNode) root) {
                if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
                    throw new StoragePersistenceException("Malformed entry in persistence file " + path);
                }
                final var entryNode = pair.get(1);
                final var value = objectMapper.treeToValue(entryNode.get("value"), Object.class);
                final var expiryNode = entryNode.get("expiry");
                final var expiry = expiryNode == null || expiryNode.isNull() ? null : expiryNode.asLong();
                store.put(pair.get(0).textValue(), new StoreEntry(value, expiry));
            }
            LOG.infof("Loaded %d entries from %s", store.size(), path);
        } catch (IOException e) {
            throw new StoragePersistenceException("Failed to load persistence file " + path, e);
        }
    }

    // Caller holds lock
    private void save() {
        if (persist.isEmpty()) {
            return;
        }
        final var path = persist.get();
        final var root = objectMapper.createArrayNode();
        for (Map.Entry<String, StoreEntry> e : store.entrySet()) {
            root.addArray().add(e.getKey()).addPOJO(e.getValue());
        }
        final var tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), root);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to persist store to %s", path);
            throw new StoragePersistenceException("Failed to persist store to " + path, e);
        }
    }

    private static String printable(String flatKey) {
        return flatKey.replace(KeyCodec.SEPARATOR, '/');
    }
}
