package openauth.core.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Endpoints advertised by an issuer's {@code /.well-known/oauth-authorization-server} document.
 *
 * @param jwksUri               JWKS endpoint
 * @param tokenEndpoint         token endpoint
 * @param authorizationEndpoint authorize endpoint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IssuerMetadata(
        @JsonProperty("jwks_uri") String jwksUri,
        @JsonProperty("token_endpoint") String tokenEndpoint,
        @JsonProperty("authorization_endpoint") String authorizationEndpoint) {

    public IssuerMetadata {
        if (jwksUri == null || jwksUri.isBlank()) {
            throw new IllegalArgumentException("Issuer metadata is missing jwks_uri");
        }
    }
}
