package openauth.core.model.oauth;

import java.util.Map;

/**
 * Properties stored against an issued refresh token.
 *
 * @param type       subject type of the grant
 * @param properties subject properties of the grant
 * @param clientId   client the token was issued to
 */
public record RefreshTokenGrant(String type, Map<String, Object> properties, String clientId) {

    public RefreshTokenGrant {
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
}
