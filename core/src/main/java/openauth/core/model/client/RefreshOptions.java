package openauth.core.model.client;

import java.util.Optional;

/**
 * Options for {@code refresh}.
 *
 * @param access current access token; when it is still valid beyond the refresh window the
 *               refresh is skipped
 */
public record RefreshOptions(Optional<String> access) {

    private static final RefreshOptions NONE = new RefreshOptions(Optional.empty());

    public RefreshOptions {
        if (access == null) {
            access = Optional.empty();
        }
    }

    public static RefreshOptions none() {
        return NONE;
    }

    public static RefreshOptions withAccess(String accessToken) {
        return new RefreshOptions(Optional.ofNullable(accessToken));
    }
}
