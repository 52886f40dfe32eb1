package openauth.core.model.storage;

import java.util.List;

/**
 * A key/value pair emitted by a prefix scan.
 *
 * @param key   the key segments
 * @param value the stored value
 */
public record ScanEntry(List<String> key, Object value) {

    public ScanEntry {
        key = List.copyOf(key);
    }
}
