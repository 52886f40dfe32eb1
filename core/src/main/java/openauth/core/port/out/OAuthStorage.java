package openauth.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import openauth.core.model.oauth.AuthorizationCode;
import openauth.core.model.oauth.RefreshTokenGrant;

/**
 * Storage for authorization codes and refresh tokens.
 *
 * <p>Authorization codes are keyed by code. Refresh tokens are keyed by subject and token, so a
 * subject may hold several at once (one per session or device).
 */
public interface OAuthStorage {

    /**
     * Store an authorization code.
     *
     * @param code       the code
     * @param properties the grant the code stands for
     * @param ttl        how long the code stays readable
     */
    Uni<Void> setAuthorizationCode(String code, AuthorizationCode properties, Duration ttl);

    /**
     * Read an authorization code without consuming it.
     *
     * <p>Single use is the token endpoint's job: call {@link #invalidateAuthorizationCode(String)}
     * after a successful exchange.
     *
     * @return the grant, or empty if unknown or expired
     */
    Uni<Optional<AuthorizationCode>> getAuthorizationCode(String code);

    /**
     * Remove an authorization code.
     */
    Uni<Void> invalidateAuthorizationCode(String code);

    /**
     * Store a refresh token for a subject.
     */
    Uni<Void> setRefreshToken(String subject, String refreshToken, RefreshTokenGrant properties, Duration ttl);

    /**
     * Read a refresh token for a subject.
     *
     * @return the grant, or empty if unknown or expired
     */
    Uni<Optional<RefreshTokenGrant>> getRefreshToken(String subject, String refreshToken);

    /**
     * Remove every refresh token of a subject.
     *
     * <p>Not atomic. If a removal fails the returned {@code Uni} fails and tokens already
     * removed stay removed. Calling again is safe.
     *
     * @param subject the subject
     */
    Uni<Void> invalidateKeys(String subject);
}
