package openauth.core.service.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import openauth.core.model.oauth.Pkce;

/**
 * Generates PKCE (Proof Key for Code Exchange) verifiers and S256 challenges.
 *
 * <p>Only the S256 challenge method is supported as the plain method provides
 * insufficient security.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
public class PkceGenerator {

    private static final int VERIFIER_LENGTH = 64;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>Per RFC 7636, the verifier must be between 43-128 characters,
     * using unreserved characters (A-Z, a-z, 0-9, "-", ".", "_", "~").
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateVerifier() {
        byte[] randomBytes = new byte[VERIFIER_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Compute BASE64URL(SHA256(verifier)).
     *
     * @param verifier the code verifier
     * @return the S256 challenge
     */
    public Pkce challenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Pkce.s256(Base64.getUrlEncoder().withoutPadding().encodeToString(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
