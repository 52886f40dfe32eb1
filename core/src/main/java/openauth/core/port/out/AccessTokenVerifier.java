package openauth.core.port.out;

import java.time.Instant;
import java.util.Optional;

import org.jose4j.jwk.JsonWebKeySet;

import openauth.core.model.client.AccessTokenVerification;

/**
 * Signature and claim verification for signed access tokens.
 */
public interface AccessTokenVerifier {

    /**
     * Verify a compact JWS against a key set and expected issuer.
     *
     * @param token  compact serialized JWT
     * @param keys   verification keys
     * @param issuer expected {@code iss}
     * @return the verification outcome; never throws for bad tokens
     */
    AccessTokenVerification verify(String token, JsonWebKeySet keys, String issuer);

    /**
     * Read the {@code exp} claim without checking the signature.
     *
     * @param token compact serialized JWT
     * @return the expiry, or empty if the token has no {@code exp}
     * @throws IllegalArgumentException if the token cannot be decoded
     */
    Optional<Instant> decodeExpiry(String token);
}
