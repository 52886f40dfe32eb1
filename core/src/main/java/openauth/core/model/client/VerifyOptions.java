package openauth.core.model.client;

import java.util.Optional;

/**
 * Options for {@code verify}.
 *
 * @param refresh refresh token to use if the access token has expired
 */
public record VerifyOptions(Optional<String> refresh) {

    private static final VerifyOptions NONE = new VerifyOptions(Optional.empty());

    public VerifyOptions {
        if (refresh == null) {
            refresh = Optional.empty();
        }
    }

    public static VerifyOptions none() {
        return NONE;
    }

    public static VerifyOptions withRefresh(String refreshToken) {
        return new VerifyOptions(Optional.ofNullable(refreshToken));
    }
}
