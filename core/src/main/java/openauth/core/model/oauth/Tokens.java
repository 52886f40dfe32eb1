package openauth.core.model.oauth;

/**
 * Access/refresh token pair returned by the token endpoint.
 */
public record Tokens(String access, String refresh) {

    public Tokens {
        if (access == null || access.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
    }
}
