package openauth.core.model.client;

import openauth.core.model.oauth.Tokens;

/**
 * Outcome of a refresh request.
 */
public sealed interface RefreshResult {

    /**
     * The token endpoint issued a new token pair.
     */
    record Refreshed(Tokens tokens) implements RefreshResult {}

    /**
     * The supplied access token is still valid beyond the refresh window; no call was made.
     */
    record NotNeeded() implements RefreshResult {}

    /**
     * The refresh failed.
     */
    record Failure(ClientError error) implements RefreshResult {}

    static RefreshResult failure(ErrorKind kind, String message) {
        return new Failure(ClientError.of(kind, message));
    }
}
