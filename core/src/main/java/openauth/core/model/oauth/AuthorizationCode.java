package openauth.core.model.oauth;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Properties stored against an issued authorization code.
 *
 * <p>Single use is enforced by the token endpoint, not by storage.
 *
 * @param type        subject type of the authenticated grant
 * @param properties  subject properties of the authenticated grant
 * @param clientId    client the code was issued to
 * @param redirectUri redirect URI registered with the authorize request
 * @param pkce        PKCE challenge, or null if the request did not use PKCE
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationCode(
        String type, Map<String, Object> properties, String clientId, String redirectUri, Pkce pkce) {

    public AuthorizationCode {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Subject type cannot be null or blank");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        if (properties == null) {
            properties = Map.of();
        }
    }

    public boolean hasPkce() {
        return pkce != null;
    }
}
