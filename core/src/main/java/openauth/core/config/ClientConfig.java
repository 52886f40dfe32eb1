package openauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the OAuth client.
 *
 * <p>Configuration prefix: {@code openauth.client}
 */
@ConfigMapping(prefix = "openauth.client")
public interface ClientConfig {

    /**
     * Client identifier sent to the issuer.
     *
     * @return client ID
     */
    @WithName("client-id")
    String clientId();

    /**
     * Issuer base URL.
     *
     * <p>When unset, the {@code OPENAUTH_ISSUER} environment variable is used.
     *
     * @return issuer URL
     */
    Optional<String> issuer();

    /**
     * Remaining access-token lifetime below which {@code refresh} contacts the token endpoint.
     *
     * @return refresh window (default: 30 seconds)
     */
    @WithName("refresh-window")
    @WithDefault("PT30S")
    Duration refreshWindow();

    /**
     * HTTP timeout for discovery, JWKS and token requests.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();
}
