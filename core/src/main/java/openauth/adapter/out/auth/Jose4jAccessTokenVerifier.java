package openauth.adapter.out.auth;

import java.time.Instant;
import java.util.Optional;

import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.resolvers.JwksVerificationKeyResolver;

import openauth.core.model.client.AccessTokenVerification;
import openauth.core.port.out.AccessTokenVerifier;

/**
 * Access token verifier backed by jose4j.
 *
 * <p>
 * Checks:
 * <ul>
 * <li>Signature, using the key from the set matching the token's {@code kid}</li>
 * <li>Issuer ({@code iss}) claim</li>
 * <li>Expiration ({@code exp}) and not-before ({@code nbf}) claims when present</li>
 * </ul>
 * Audience is not checked.
 */
public class Jose4jAccessTokenVerifier implements AccessTokenVerifier {

    private static final Logger LOG = Logger.getLogger(Jose4jAccessTokenVerifier.class);

    private static final JwtConsumer UNVERIFIED_CONSUMER = new JwtConsumerBuilder()
            .setSkipAllValidators()
            .setDisableRequireSignature()
            .setSkipSignatureVerification()
            .build();

    @Override
    public AccessTokenVerification verify(String token, JsonWebKeySet keys, String issuer) {
        if (token == null || token.isBlank()) {
            return new AccessTokenVerification.Invalid("No token");
        }
        try {
            final var consumer = new JwtConsumerBuilder()
                    .setExpectedIssuer(issuer)
                    .setVerificationKeyResolver(new JwksVerificationKeyResolver(keys.getJsonWebKeys()))
                    .setSkipDefaultAudienceValidation()
                    .build();
            final var claims = consumer.processToClaims(token);
            return new AccessTokenVerification.Verified(claims.getClaimsMap());
        } catch (InvalidJwtException e) {
            if (isOnlyExpired(e)) {
                LOG.debug("Access token has expired");
                return new AccessTokenVerification.Expired();
            }
            LOG.debugv("Access token verification failed: {0}", e.getMessage());
            return new AccessTokenVerification.Invalid(summarizeJwtError(e));
        }
    }

    @Override
    public Optional<Instant> decodeExpiry(String token) {
        try {
            final var claims = UNVERIFIED_CONSUMER.processToClaims(token);
            final NumericDate expiration = claims.getExpirationTime();
            return Optional.ofNullable(expiration).map(exp -> Instant.ofEpochSecond(exp.getValue()));
        } catch (InvalidJwtException | MalformedClaimException e) {
            throw new IllegalArgumentException("Failed to decode token: " + e.getMessage(), e);
        }
    }

    // hasExpired() is also true when expiry is one of several failures, e.g. a foreign issuer
    private static boolean isOnlyExpired(InvalidJwtException e) {
        final var details = e.getErrorDetails();
        return !details.isEmpty() && details.stream().allMatch(error -> error.getErrorCode() == ErrorCodes.EXPIRED);
    }

    private String summarizeJwtError(InvalidJwtException e) {
        final var message = e.getMessage() == null ? "" : e.getMessage();
        if (message.contains("issuer")) {
            return "Invalid token issuer";
        }
        if (message.contains("signature")) {
            return "Invalid token signature";
        }
        return "Token validation failed";
    }
}
