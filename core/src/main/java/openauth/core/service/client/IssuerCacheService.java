package openauth.core.service.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import openauth.core.model.client.HttpFetchResponse;
import openauth.core.model.oauth.IssuerMetadata;
import openauth.core.port.out.HttpFetcher;
import openauth.core.port.out.IssuerCache;

/**
 * Caches issuer discovery documents and JSON Web Key Sets.
 *
 * <p>Features:
 * <ul>
 *   <li>One fetch per issuer for the lifetime of this object, no TTL</li>
 *   <li>Request coalescing: concurrent first lookups for an issuer share one in-flight fetch</li>
 *   <li>Failed fetches are not cached, so the next lookup tries again</li>
 * </ul>
 *
 * <p>Each instance owns its own entries. Create one per client (or share one between clients
 * of the same issuers); dropping the instance drops the cache.
 */
public class IssuerCacheService implements IssuerCache {

    private static final Logger LOG = Logger.getLogger(IssuerCacheService.class);
    static final String DISCOVERY_PATH = "/.well-known/oauth-authorization-server";

    private final HttpFetcher fetcher;
    private final ObjectMapper objectMapper;

    // Caffeine discards a future that completes exceptionally, which gives single-flight
    // without caching failures
    private final AsyncCache<String, IssuerMetadata> metadata =
            Caffeine.newBuilder().buildAsync();
    private final AsyncCache<String, JsonWebKeySet> keySets =
            Caffeine.newBuilder().buildAsync();

    public IssuerCacheService(HttpFetcher fetcher, ObjectMapper objectMapper) {
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<IssuerMetadata> resolveMetadata(String issuer) {
        return Uni.createFrom()
                .completionStage(() -> metadata.get(
                        issuer, (key, executor) -> fetchMetadata(key).subscribeAsCompletionStage()));
    }

    @Override
    public Uni<JsonWebKeySet> resolveKeySet(String issuer) {
        return Uni.createFrom()
                .completionStage(() -> keySets.get(issuer, (key, executor) -> resolveMetadata(key)
                        .flatMap(wellKnown -> fetchKeySet(key, wellKnown.jwksUri()))
                        .subscribeAsCompletionStage()));
    }

    @Override
    public void invalidate(String issuer) {
        LOG.infov("Invalidating cached metadata and keys for {0}", issuer);
        metadata.synchronous().invalidate(issuer);
        keySets.synchronous().invalidate(issuer);
    }

    private Uni<IssuerMetadata> fetchMetadata(String issuer) {
        final var url = issuer + DISCOVERY_PATH;
        LOG.infov("Fetching issuer metadata from {0}", url);
        return fetcher.get(url).map(response -> parseMetadata(url, response));
    }

    private Uni<JsonWebKeySet> fetchKeySet(String issuer, String jwksUri) {
        LOG.infov("Fetching JWKS for {0} from {1}", issuer, jwksUri);
        return fetcher.get(jwksUri)
                .map(response -> parseKeySet(jwksUri, response))
                .invoke(keySet -> LOG.infov(
                        "Cached {0} keys for {1}", keySet.getJsonWebKeys().size(), issuer));
    }

    private IssuerMetadata parseMetadata(String url, HttpFetchResponse response) {
        if (!response.ok()) {
            throw new IssuerFetchException("Discovery endpoint " + url + " returned status " + response.statusCode());
        }
        try {
            return objectMapper.readValue(response.body(), IssuerMetadata.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IssuerFetchException("Failed to parse issuer metadata from " + url + ": " + e.getMessage(), e);
        }
    }

    private JsonWebKeySet parseKeySet(String jwksUri, HttpFetchResponse response) {
        if (!response.ok()) {
            throw new IssuerFetchException("JWKS endpoint " + jwksUri + " returned status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.body());
        } catch (JoseException e) {
            throw new IssuerFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    /**
     * Exception thrown when issuer metadata or keys cannot be fetched.
     *
     * <p>This can occur due to a non-2xx response or a malformed body.
     */
    public static class IssuerFetchException extends RuntimeException {
        public IssuerFetchException(String message) {
            super(message);
        }

        public IssuerFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
