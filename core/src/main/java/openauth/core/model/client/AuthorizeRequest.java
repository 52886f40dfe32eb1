package openauth.core.model.client;

/**
 * A PKCE authorize URL and the verifier the caller must keep for the code exchange.
 *
 * @param verifier PKCE code verifier
 * @param url      authorize URL carrying the matching S256 challenge
 */
public record AuthorizeRequest(String verifier, String url) {}
