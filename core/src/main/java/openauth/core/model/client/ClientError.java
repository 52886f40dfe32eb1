package openauth.core.model.client;

/**
 * A typed client failure.
 *
 * @param kind    failure kind
 * @param message human-readable reason, for logs only
 */
public record ClientError(ErrorKind kind, String message) {

    public ClientError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = kind.name();
        }
    }

    public static ClientError of(ErrorKind kind, String message) {
        return new ClientError(kind, message);
    }
}
