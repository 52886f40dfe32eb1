package openauth.core.port.out;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

import openauth.core.model.oauth.IssuerMetadata;

/**
 * Cache of issuer discovery documents and verification key sets.
 *
 * <p>Entries are fetched once per issuer and kept for the lifetime of the cache object.
 * Concurrent first requests for the same issuer share one fetch.
 */
public interface IssuerCache {

    /**
     * Resolve the issuer's discovery document.
     *
     * @param issuer issuer base URL
     */
    Uni<IssuerMetadata> resolveMetadata(String issuer);

    /**
     * Resolve the issuer's verification keys from its {@code jwks_uri}.
     *
     * @param issuer issuer base URL
     */
    Uni<JsonWebKeySet> resolveKeySet(String issuer);

    /**
     * Drop everything cached for an issuer, forcing a fetch on next use.
     */
    void invalidate(String issuer);
}
