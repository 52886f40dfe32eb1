package openauth.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import openauth.core.model.storage.ScanEntry;

/**
 * Ordered key-value storage with per-entry expiry.
 *
 * <p>Keys are segment lists, flattened with {@link openauth.core.util.KeyCodec}. Entries are
 * kept in ascending flat-key order.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Expired entries MUST NOT be returned by {@link #get(List)} or {@link #scan(List)}</li>
 *   <li>{@link #set(List, Object, Instant)} MUST replace, never merge, an existing value</li>
 *   <li>{@link #remove(List)} on a missing key MUST complete without error</li>
 *   <li>Storage failures MUST surface as a failed {@code Uni}</li>
 * </ul>
 */
public interface KeyValueStorage {

    /**
     * Read a value.
     *
     * <p>An expired entry is removed as a side effect.
     *
     * @param key key segments
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<Object>> get(List<String> key);

    /**
     * Store a value, replacing any existing one.
     *
     * @param key    key segments
     * @param value  JSON-compatible value
     * @param expiry absolute expiry, or null for none
     * @return Uni completing once stored
     */
    Uni<Void> set(List<String> key, Object value, Instant expiry);

    /**
     * Store a value that never expires.
     */
    default Uni<Void> set(List<String> key, Object value) {
        return set(key, value, null);
    }

    /**
     * Remove a value if present.
     *
     * @param key key segments
     * @return Uni completing once removed
     */
    Uni<Void> remove(List<String> key);

    /**
     * Stream every unexpired entry under a key prefix, in key order.
     *
     * <p>Evaluated over the entries present at subscription. Expired entries are skipped but
     * not deleted. Each subscription scans again.
     *
     * @param prefix key prefix segments; empty matches every entry
     * @return the matching entries
     */
    Multi<ScanEntry> scan(List<String> prefix);
}
