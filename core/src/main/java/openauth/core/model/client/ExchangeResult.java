package openauth.core.model.client;

import openauth.core.model.oauth.Tokens;

/**
 * Outcome of exchanging an authorization code for tokens.
 */
public sealed interface ExchangeResult {

    record Exchanged(Tokens tokens) implements ExchangeResult {}

    record Failure(ClientError error) implements ExchangeResult {}

    static ExchangeResult failure(ErrorKind kind, String message) {
        return new Failure(ClientError.of(kind, message));
    }
}
