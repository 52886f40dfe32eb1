package openauth.adapter.out.storage;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import openauth.adapter.out.storage.memory.MemoryKeyValueStorage;
import openauth.core.config.StorageConfig;
import openauth.core.port.out.KeyValueStorage;
import openauth.core.port.out.OAuthStorage;
import openauth.core.service.storage.KeyValueOAuthStorage;

/**
 * CDI producer for the key-value store and the OAuth storage built on it.
 *
 * <p>Applications with their own {@link KeyValueStorage} can provide it as an alternative bean;
 * {@link OAuthStorage} then layers on top of it unchanged.
 */
@ApplicationScoped
public class OAuthStorageProducer {

    private static final Logger LOG = Logger.getLogger(OAuthStorageProducer.class);

    private final StorageConfig config;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    @Inject
    public OAuthStorageProducer(StorageConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public KeyValueStorage keyValueStorage() {
        final var persist = config.persist().map(Path::of);
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: OAuth storage is in-memory!");
            LOG.warn(persist.isPresent()
                    ? "  State is persisted to " + persist.get() + " with no cross-process locking."
                    : "  Authorization codes and refresh tokens are lost on restart.");
            LOG.warn("  Do not share the store between instances.");
            LOG.warn("========================================================================");
        }
        return new MemoryKeyValueStorage(persist, objectMapper, Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public OAuthStorage oauthStorage(KeyValueStorage storage) {
        return new KeyValueOAuthStorage(storage, objectMapper);
    }
}
