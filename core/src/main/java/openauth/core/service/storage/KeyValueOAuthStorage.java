package openauth.core.service.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import openauth.core.model.oauth.AuthorizationCode;
import openauth.core.model.oauth.RefreshTokenGrant;
import openauth.core.port.out.KeyValueStorage;
import openauth.core.port.out.OAuthStorage;
import openauth.core.util.KeyCodec;

/**
 * {@link OAuthStorage} on top of any {@link KeyValueStorage}.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code ["oauth:code", code]} - authorization codes</li>
 *   <li>{@code ["oauth:refresh", subject, token]} - refresh tokens</li>
 * </ul>
 * Every identifier is sanitized with {@link KeyCodec#sanitize(String)} before use. Holds no
 * state of its own.
 */
public class KeyValueOAuthStorage implements OAuthStorage {

    private static final Logger LOG = Logger.getLogger(KeyValueOAuthStorage.class);

    static final String CODE_PREFIX = "oauth:code";
    static final String REFRESH_PREFIX = "oauth:refresh";

    private final KeyValueStorage storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public KeyValueOAuthStorage(KeyValueStorage storage, ObjectMapper objectMapper) {
        this(storage, objectMapper, Clock.systemUTC());
    }

    public KeyValueOAuthStorage(KeyValueStorage storage, ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Uni<Void> setAuthorizationCode(String code, AuthorizationCode properties, Duration ttl) {
        return storage.set(codeKey(code), objectMapper.convertValue(properties, Object.class), expiry(ttl));
    }

    @Override
    public Uni<Optional<AuthorizationCode>> getAuthorizationCode(String code) {
        return storage.get(codeKey(code)).map(value -> value.map(v -> convert(v, AuthorizationCode.class)));
    }

    @Override
    public Uni<Void> invalidateAuthorizationCode(String code) {
        return storage.remove(codeKey(code));
    }

    @Override
    public Uni<Void> setRefreshToken(
            String subject, String refreshToken, RefreshTokenGrant properties, Duration ttl) {
        return storage.set(
                refreshKey(subject, refreshToken), objectMapper.convertValue(properties, Object.class), expiry(ttl));
    }

    @Override
    public Uni<Optional<RefreshTokenGrant>> getRefreshToken(String subject, String refreshToken) {
        return storage.get(refreshKey(subject, refreshToken))
                .map(value -> value.map(v -> convert(v, RefreshTokenGrant.class)));
    }

    @Override
    public Uni<Void> invalidateKeys(String subject) {
        final var prefix = List.of(REFRESH_PREFIX, KeyCodec.sanitize(subject));
        return storage.scan(prefix)
                .onItem()
                .transformToUniAndConcatenate(entry -> storage.remove(entry.key()).replaceWith(entry))
                .collect()
                .with(Collectors.counting())
                .invoke(count -> LOG.debugf("Invalidated %d refresh tokens for subject %s", count, subject))
                .onFailure()
                .invoke(error -> LOG.warnf(error, "Refresh token invalidation for subject %s stopped part way", subject))
                .replaceWithVoid();
    }

    private Instant expiry(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private <T> T convert(Object value, Class<T> type) {
        return objectMapper.convertValue(value, type);
    }

    static List<String> codeKey(String code) {
        return List.of(CODE_PREFIX, KeyCodec.sanitize(code));
    }

    static List<String> refreshKey(String subject, String refreshToken) {
        return List.of(REFRESH_PREFIX, KeyCodec.sanitize(subject), KeyCodec.sanitize(refreshToken));
    }
}
