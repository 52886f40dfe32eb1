package openauth.core.model.client;

/**
 * Failure kinds reported by the OAuth client.
 */
public enum ErrorKind {
    /** The token endpoint rejected an authorization code exchange. */
    INVALID_AUTHORIZATION_CODE,
    /** The token endpoint rejected a refresh, or the refresh call failed. */
    INVALID_REFRESH_TOKEN,
    /** The access token failed verification for a reason other than a recoverable expiry. */
    INVALID_ACCESS_TOKEN,
    /** The token payload failed subject validation or is not an access token. */
    INVALID_SUBJECT
}
