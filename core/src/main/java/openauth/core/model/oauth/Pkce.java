package openauth.core.model.oauth;

/**
 * PKCE challenge bound to an authorization code.
 *
 * @param challenge BASE64URL(SHA-256(verifier))
 * @param method    challenge method; only S256 is supported
 */
public record Pkce(String challenge, String method) {

    public static final String S256 = "S256";

    public Pkce {
        if (challenge == null || challenge.isBlank()) {
            throw new IllegalArgumentException("PKCE challenge cannot be null or blank");
        }
        if (method == null) {
            method = S256;
        }
        if (!S256.equals(method)) {
            throw new IllegalArgumentException("Unsupported PKCE method: " + method);
        }
    }

    public static Pkce s256(String challenge) {
        return new Pkce(challenge, S256);
    }
}
