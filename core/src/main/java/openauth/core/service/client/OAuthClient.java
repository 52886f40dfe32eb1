package openauth.core.service.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import openauth.core.config.ClientConfig;
import openauth.core.model.client.AccessTokenVerification;
import openauth.core.model.client.AuthorizeRequest;
import openauth.core.model.client.ErrorKind;
import openauth.core.model.client.ExchangeResult;
import openauth.core.model.client.HttpFetchResponse;
import openauth.core.model.client.RefreshOptions;
import openauth.core.model.client.RefreshResult;
import openauth.core.model.client.SchemaResult;
import openauth.core.model.client.SubjectSchema;
import openauth.core.model.client.VerifyOptions;
import openauth.core.model.client.VerifyResult;
import openauth.core.model.oauth.Subject;
import openauth.core.model.oauth.Tokens;
import openauth.core.port.out.AccessTokenVerifier;
import openauth.core.port.out.HttpFetcher;
import openauth.core.port.out.IssuerCache;
import openauth.spi.ConfigurationException;

/**
 * Client for a single OAuth issuer.
 *
 * <p>Builds authorize URLs, exchanges authorization codes, refreshes tokens and verifies access
 * tokens. {@link #verify(Map, String, VerifyOptions)} refreshes an expired access token at most
 * once per call when a refresh token is supplied.
 *
 * <p>All outcomes in the error taxonomy ({@link ErrorKind}) are returned as values. Only transport
 * failures during {@link #exchange(String, String, Optional)} fail the returned {@code Uni}.
 */
public class OAuthClient {

    private static final Logger LOG = Logger.getLogger(OAuthClient.class);

    static final String ISSUER_ENV = "OPENAUTH_ISSUER";
    static final String ACCESS_MODE = "access";

    private final String clientId;
    private final String issuer;
    private final Duration refreshWindow;
    private final HttpFetcher fetcher;
    private final IssuerCache issuerCache;
    private final AccessTokenVerifier verifier;
    private final ObjectMapper objectMapper;
    private final PkceGenerator pkceGenerator = new PkceGenerator();
    private final Clock clock;

    public OAuthClient(
            ClientConfig config,
            HttpFetcher fetcher,
            IssuerCache issuerCache,
            AccessTokenVerifier verifier,
            ObjectMapper objectMapper) {
        this(config, fetcher, issuerCache, verifier, objectMapper, System::getenv, Clock.systemUTC());
    }

    OAuthClient(
            ClientConfig config,
            HttpFetcher fetcher,
            IssuerCache issuerCache,
            AccessTokenVerifier verifier,
            ObjectMapper objectMapper,
            Function<String, String> environment,
            Clock clock) {
        if (config.clientId() == null || config.clientId().isBlank()) {
            throw new ConfigurationException("No client ID configured");
        }
        this.clientId = config.clientId();
        this.issuer = resolveIssuer(config.issuer(), environment);
        this.refreshWindow = config.refreshWindow();
        this.fetcher = fetcher;
        this.issuerCache = issuerCache;
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    static String resolveIssuer(Optional<String> configured, Function<String, String> environment) {
        return configured
                .filter(value -> !value.isBlank())
                .or(() -> Optional.ofNullable(environment.apply(ISSUER_ENV)).filter(value -> !value.isBlank()))
                .map(value -> value.endsWith("/") ? value.substring(0, value.length() - 1) : value)
                .orElseThrow(() -> new ConfigurationException(
                        "No issuer configured: set openauth.client.issuer or " + ISSUER_ENV));
    }

    public String issuer() {
        return issuer;
    }

    /**
     * Build the issuer's authorize URL.
     *
     * @param redirectUri  where the issuer sends the user back to
     * @param responseType {@code code} or {@code token}
     * @param provider     identity provider to preselect, if any
     * @return the authorize URL
     */
    public String authorize(String redirectUri, String responseType, Optional<String> provider) {
        return authorizeUrl(authorizeParams(redirectUri, responseType, provider));
    }

    /**
     * Build an authorize URL for the code flow with a fresh PKCE challenge.
     *
     * @param redirectUri where the issuer sends the user back to
     * @param provider    identity provider to preselect, if any
     * @return the URL and the verifier to pass to {@link #exchange(String, String, Optional)}
     */
    public AuthorizeRequest pkce(String redirectUri, Optional<String> provider) {
        final var verifierValue = pkceGenerator.generateVerifier();
        final var challenge = pkceGenerator.challenge(verifierValue);
        final var params = authorizeParams(redirectUri, "code", provider);
        params.put("code_challenge_method", challenge.method());
        params.put("code_challenge", challenge.challenge());
        return new AuthorizeRequest(verifierValue, authorizeUrl(params));
    }

    private Map<String, String> authorizeParams(String redirectUri, String responseType, Optional<String> provider) {
        final var params = new LinkedHashMap<String, String>();
        provider.ifPresent(value -> params.put("provider", value));
        params.put("client_id", clientId);
        params.put("redirect_uri", redirectUri);
        params.put("response_type", responseType);
        return params;
    }

    private String authorizeUrl(Map<String, String> params) {
        return issuer + "/authorize?"
                + params.entrySet().stream()
                        .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                        .collect(Collectors.joining("&"));
    }

    /**
     * Exchange an authorization code for tokens.
     *
     * @param code        the authorization code
     * @param redirectUri the redirect URI used in the authorize request
     * @param codeVerifier PKCE verifier, if the authorize request carried a challenge
     * @return the token pair, or {@link ErrorKind#INVALID_AUTHORIZATION_CODE} if the issuer
     *         rejected the code or answered 2xx without a readable {@code access_token}
     */
    public Uni<ExchangeResult> exchange(String code, String redirectUri, Optional<String> codeVerifier) {
        final var form = new LinkedHashMap<String, String>();
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        form.put("grant_type", "authorization_code");
        form.put("client_id", clientId);
        form.put("code_verifier", codeVerifier.orElse(""));

        return fetcher.postForm(tokenEndpoint(), form).map(response -> {
            if (!response.ok()) {
                LOG.warnf("Code exchange rejected with status %d: %s", response.statusCode(), response.body());
                return ExchangeResult.failure(
                        ErrorKind.INVALID_AUTHORIZATION_CODE, "Token endpoint returned " + response.statusCode());
            }
            try {
                return new ExchangeResult.Exchanged(parseTokens(response));
            } catch (IllegalStateException e) {
                LOG.warnf("Code exchange returned an unreadable token response: %s", e.getMessage());
                return ExchangeResult.failure(ErrorKind.INVALID_AUTHORIZATION_CODE, e.getMessage());
            }
        });
    }

    /**
     * Refresh tokens.
     *
     * <p>If {@code options.access} is given and stays valid for longer than the refresh window,
     * nothing is sent and {@link RefreshResult.NotNeeded} is returned.
     *
     * @param refreshToken the refresh token
     * @param options      refresh options
     */
    public Uni<RefreshResult> refresh(String refreshToken, RefreshOptions options) {
        if (options.access().isPresent()) {
            final Optional<Instant> expiry;
            try {
                expiry = verifier.decodeExpiry(options.access().get());
            } catch (IllegalArgumentException e) {
                LOG.debugv("Could not decode access token: {0}", e.getMessage());
                return Uni.createFrom().item(RefreshResult.failure(ErrorKind.INVALID_ACCESS_TOKEN, e.getMessage()));
            }
            if (expiry.orElse(Instant.EPOCH).isAfter(clock.instant().plus(refreshWindow))) {
                return Uni.createFrom().item(new RefreshResult.NotNeeded());
            }
        }
        return requestRefresh(refreshToken);
    }

    private Uni<RefreshResult> requestRefresh(String refreshToken) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);

        return fetcher.postForm(tokenEndpoint(), form)
                .map(response -> {
                    if (!response.ok()) {
                        LOG.debugf("Refresh rejected with status %d", response.statusCode());
                        return RefreshResult.failure(
                                ErrorKind.INVALID_REFRESH_TOKEN, "Token endpoint returned " + response.statusCode());
                    }
                    return (RefreshResult) new RefreshResult.Refreshed(parseTokens(response));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(error, "Refresh request failed");
                    return RefreshResult.failure(ErrorKind.INVALID_REFRESH_TOKEN, error.getMessage());
                });
    }

    /**
     * Verify an access token and validate its subject.
     *
     * <p>Steps:
     * <ol>
     *   <li>Resolve the issuer's keys and verify signature, issuer and expiry</li>
     *   <li>If the token has expired and {@code options.refresh} is present, refresh once and
     *   verify the new access token; a second expiry is a failure</li>
     *   <li>Validate {@code properties} with the schema registered for the token's {@code type}
     *   and require {@code mode} to be {@code access}</li>
     * </ol>
     *
     * @param subjects     schema per subject type
     * @param accessToken  the access token
     * @param options      verify options
     * @return the subject, plus the new token pair if a refresh happened, or a failure
     */
    public Uni<VerifyResult> verify(Map<String, SubjectSchema> subjects, String accessToken, VerifyOptions options) {
        return checkToken(accessToken)
                .flatMap(result -> {
                    if (result instanceof AccessTokenVerification.Expired
                            && options.refresh().isPresent()) {
                        return refreshAndRetry(subjects, options.refresh().get());
                    }
                    return Uni.createFrom().item(toVerifyResult(subjects, result, Optional.empty()));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf(error, "Unexpected failure verifying access token");
                    return VerifyResult.failure(ErrorKind.INVALID_ACCESS_TOKEN, error.getMessage());
                });
    }

    private Uni<VerifyResult> refreshAndRetry(Map<String, SubjectSchema> subjects, String refreshToken) {
        LOG.debug("Access token expired, refreshing");
        return requestRefresh(refreshToken).flatMap(refreshed -> {
            if (refreshed instanceof RefreshResult.Failure failure) {
                return Uni.createFrom().item((VerifyResult) new VerifyResult.Failure(failure.error()));
            }
            final var tokens = ((RefreshResult.Refreshed) refreshed).tokens();
            // The retry is final: an expired result here is not refreshed again
            return checkToken(tokens.access()).map(result -> toVerifyResult(subjects, result, Optional.of(tokens)));
        });
    }

    private Uni<AccessTokenVerification> checkToken(String accessToken) {
        return issuerCache.resolveKeySet(issuer).map(keys -> verifier.verify(accessToken, keys, issuer));
    }

    private VerifyResult toVerifyResult(
            Map<String, SubjectSchema> subjects, AccessTokenVerification result, Optional<Tokens> tokens) {
        if (result instanceof AccessTokenVerification.Expired) {
            return VerifyResult.failure(ErrorKind.INVALID_ACCESS_TOKEN, "Token has expired");
        }
        if (result instanceof AccessTokenVerification.Invalid invalid) {
            return VerifyResult.failure(ErrorKind.INVALID_ACCESS_TOKEN, invalid.reason());
        }
        final var claims = ((AccessTokenVerification.Verified) result).claims();

        if (!(claims.get("type") instanceof String type)) {
            return VerifyResult.failure(ErrorKind.INVALID_SUBJECT, "Token has no subject type");
        }
        final var schema = subjects.get(type);
        if (schema == null) {
            return VerifyResult.failure(ErrorKind.INVALID_SUBJECT, "Unknown subject type: " + type);
        }
        final var validated = schema.validate(claims.get("properties"));
        if (validated instanceof SchemaResult.Issues issues) {
            LOG.debugf("Subject %s failed validation: %s", type, issues.issues());
            return VerifyResult.failure(ErrorKind.INVALID_SUBJECT, "Subject failed validation");
        }
        if (!ACCESS_MODE.equals(claims.get("mode"))) {
            return VerifyResult.failure(ErrorKind.INVALID_SUBJECT, "Token is not an access token");
        }
        return new VerifyResult.Success(new Subject(type, ((SchemaResult.Valid) validated).value()), tokens);
    }

    private Tokens parseTokens(HttpFetchResponse response) {
        try {
            final var json = objectMapper.readTree(response.body());
            final var refresh = json.path("refresh_token");
            return new Tokens(
                    json.path("access_token").asText(null), refresh.isTextual() ? refresh.textValue() : null);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Malformed token endpoint response: " + e.getMessage(), e);
        }
    }

    private String tokenEndpoint() {
        return issuer + "/token";
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
