package openauth.core.model.client;

import java.util.Map;

/**
 * Result of checking an access token's signature and registered claims.
 */
public sealed interface AccessTokenVerification {

    /**
     * Signature and claims are valid.
     *
     * @param claims all claims of the token
     */
    record Verified(Map<String, Object> claims) implements AccessTokenVerification {
        public Verified {
            claims = claims == null ? Map.of() : Map.copyOf(claims);
        }
    }

    /**
     * The token is well formed and correctly signed but its {@code exp} has passed.
     */
    record Expired() implements AccessTokenVerification {}

    /**
     * The token failed verification for any other reason.
     */
    record Invalid(String reason) implements AccessTokenVerification {}
}
