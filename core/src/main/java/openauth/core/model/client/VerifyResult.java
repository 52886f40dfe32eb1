package openauth.core.model.client;

import java.util.Optional;

import openauth.core.model.oauth.Subject;
import openauth.core.model.oauth.Tokens;

/**
 * Outcome of verifying an access token.
 */
public sealed interface VerifyResult {

    /**
     * The token verified and its subject validated.
     *
     * @param subject the validated subject
     * @param tokens  the refreshed token pair, present only if a refresh happened during the call
     */
    record Success(Subject subject, Optional<Tokens> tokens) implements VerifyResult {
        public Success {
            if (subject == null) {
                throw new IllegalArgumentException("Subject cannot be null");
            }
            if (tokens == null) {
                tokens = Optional.empty();
            }
        }
    }

    /**
     * Verification failed.
     */
    record Failure(ClientError error) implements VerifyResult {}

    static VerifyResult failure(ErrorKind kind, String message) {
        return new Failure(ClientError.of(kind, message));
    }
}
