package openauth.core.model.storage;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A stored value and its optional absolute expiry.
 *
 * @param value  JSON-compatible payload (maps, lists, strings, numbers, booleans)
 * @param expiry expiry as epoch milliseconds, or null if the entry never expires
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreEntry(Object value, Long expiry) {

    public static StoreEntry of(Object value, Instant expiry) {
        return new StoreEntry(value, expiry == null ? null : expiry.toEpochMilli());
    }

    /**
     * An entry is expired once {@code now >= expiry}.
     */
    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiry != null && now.toEpochMilli() >= expiry;
    }
}
