package openauth.core.service.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import openauth.core.model.client.HttpFetchResponse;
import openauth.core.model.oauth.IssuerMetadata;
import openauth.core.port.out.HttpFetcher;
import openauth.mock.SigningKeyFixture;

@DisplayName("IssuerCacheService")
@ExtendWith(MockitoExtension.class)
class IssuerCacheServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String ISSUER = "https://auth.example.com";
    private static final String DISCOVERY_URL = ISSUER + "/.well-known/oauth-authorization-server";
    private static final String JWKS_URL = ISSUER + "/.well-known/jwks.json";
    private static final String METADATA_JSON = """
            {
              "issuer": "https://auth.example.com",
              "jwks_uri": "https://auth.example.com/.well-known/jwks.json",
              "token_endpoint": "https://auth.example.com/token",
              "authorization_endpoint": "https://auth.example.com/authorize"
            }
            """;

    private static SigningKeyFixture signingKey;

    @Mock
    private HttpFetcher fetcher;

    private IssuerCacheService cache;

    @BeforeAll
    static void setUpKeys() {
        signingKey = new SigningKeyFixture("key-1");
    }

    @BeforeEach
    void setUp() {
        cache = new IssuerCacheService(fetcher, new ObjectMapper());
    }

    private static Uni<HttpFetchResponse> respond(int status, String body) {
        return Uni.createFrom().item(new HttpFetchResponse(status, body));
    }

    @Nested
    @DisplayName("resolveMetadata()")
    class ResolveMetadataTests {

        @Test
        @DisplayName("should fetch and parse the discovery document")
        void shouldFetchAndParse() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));

            final var metadata = cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT);

            assertEquals(
                    new IssuerMetadata(JWKS_URL, ISSUER + "/token", ISSUER + "/authorize"), metadata);
        }

        @Test
        @DisplayName("should fetch once per issuer")
        void shouldFetchOnce() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));

            final var first = cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT);
            final var second = cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT);

            assertSame(first, second);
            verify(fetcher, times(1)).get(DISCOVERY_URL);
        }

        @Test
        @DisplayName("should share one in-flight fetch between concurrent callers")
        void shouldCoalesceConcurrentFetches() throws Exception {
            final var pending = new CompletableFuture<HttpFetchResponse>();
            when(fetcher.get(DISCOVERY_URL)).thenReturn(Uni.createFrom().completionStage(pending));

            final var first = cache.resolveMetadata(ISSUER).subscribeAsCompletionStage();
            final var second = cache.resolveMetadata(ISSUER).subscribeAsCompletionStage();
            pending.complete(new HttpFetchResponse(200, METADATA_JSON));

            assertSame(first.get(1, TimeUnit.SECONDS), second.get(1, TimeUnit.SECONDS));
            verify(fetcher, times(1)).get(DISCOVERY_URL);
        }

        @Test
        @DisplayName("should not cache a failed fetch")
        void shouldNotCacheFailure() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(503, "")).thenReturn(respond(200, METADATA_JSON));

            assertThrows(
                    IssuerCacheService.IssuerFetchException.class,
                    () -> cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT));
            final var metadata = cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT);

            assertEquals(JWKS_URL, metadata.jwksUri());
            verify(fetcher, times(2)).get(DISCOVERY_URL);
        }

        @Test
        @DisplayName("should fail for a document without jwks_uri")
        void shouldFailWithoutJwksUri() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, "{\"token_endpoint\": \"x\"}"));

            assertThrows(
                    IssuerCacheService.IssuerFetchException.class,
                    () -> cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("resolveKeySet()")
    class ResolveKeySetTests {

        @Test
        @DisplayName("should fetch keys from the advertised jwks_uri")
        void shouldFetchKeys() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));
            when(fetcher.get(JWKS_URL)).thenReturn(respond(200, signingKey.jwksJson()));

            final var keySet = cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT);

            assertEquals(1, keySet.getJsonWebKeys().size());
            assertEquals("key-1", keySet.getJsonWebKeys().get(0).getKeyId());
        }

        @Test
        @DisplayName("should fetch metadata and keys once")
        void shouldFetchOnce() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));
            when(fetcher.get(JWKS_URL)).thenReturn(respond(200, signingKey.jwksJson()));

            final var first = cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT);
            final var second = cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT);
            cache.resolveMetadata(ISSUER).await().atMost(TIMEOUT);

            assertSame(first, second);
            verify(fetcher, times(1)).get(DISCOVERY_URL);
            verify(fetcher, times(1)).get(JWKS_URL);
        }

        @Test
        @DisplayName("should fail on a malformed key set")
        void shouldFailOnMalformedKeySet() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));
            when(fetcher.get(JWKS_URL)).thenReturn(respond(200, "not json"));

            assertThrows(
                    IssuerCacheService.IssuerFetchException.class,
                    () -> cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fetch again after invalidate()")
        void shouldRefetchAfterInvalidate() {
            when(fetcher.get(DISCOVERY_URL)).thenReturn(respond(200, METADATA_JSON));
            when(fetcher.get(JWKS_URL)).thenReturn(respond(200, signingKey.jwksJson()));

            cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT);
            cache.invalidate(ISSUER);
            cache.resolveKeySet(ISSUER).await().atMost(TIMEOUT);

            verify(fetcher, times(2)).get(DISCOVERY_URL);
            verify(fetcher, times(2)).get(JWKS_URL);
        }
    }
}
