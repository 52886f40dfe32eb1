package openauth.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for the key-value store backing OAuth storage.
 *
 * <p>Configuration prefix: {@code openauth.storage}
 */
@ConfigMapping(prefix = "openauth.storage")
public interface StorageConfig {

    /**
     * File the in-memory store persists to.
     *
     * <p>When set, the file is loaded at startup and rewritten in full after every mutation.
     * When unset, the store is memory-only and lost on restart.
     *
     * @return persistence file path
     */
    Optional<String> persist();
}
