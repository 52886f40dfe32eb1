package openauth.adapter.out.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.Vertx;

import openauth.adapter.out.auth.Jose4jAccessTokenVerifier;
import openauth.core.config.ClientConfig;
import openauth.core.port.out.AccessTokenVerifier;
import openauth.core.port.out.HttpFetcher;
import openauth.core.port.out.IssuerCache;
import openauth.core.service.client.IssuerCacheService;
import openauth.core.service.client.OAuthClient;

/**
 * Produces the OAuth client and its collaborators from {@link ClientConfig}.
 */
@ApplicationScoped
public class OAuthClientProducer {

    private final ClientConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public OAuthClientProducer(ClientConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public HttpFetcher httpFetcher(Vertx vertx) {
        return new VertxHttpFetcher(vertx, config.timeout());
    }

    @Produces
    @ApplicationScoped
    public IssuerCache issuerCache(HttpFetcher fetcher) {
        return new IssuerCacheService(fetcher, objectMapper);
    }

    @Produces
    @ApplicationScoped
    public AccessTokenVerifier accessTokenVerifier() {
        return new Jose4jAccessTokenVerifier();
    }

    @Produces
    @ApplicationScoped
    public OAuthClient oauthClient(HttpFetcher fetcher, IssuerCache issuerCache, AccessTokenVerifier verifier) {
        return new OAuthClient(config, fetcher, issuerCache, verifier, objectMapper);
    }
}
