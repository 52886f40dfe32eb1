package openauth.core.model.client;

/**
 * Minimal view of an HTTP response as the client needs it.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty if none
 */
public record HttpFetchResponse(int statusCode, String body) {

    public HttpFetchResponse {
        if (body == null) {
            body = "";
        }
    }

    /**
     * True for 2xx responses.
     */
    public boolean ok() {
        return statusCode >= 200 && statusCode < 300;
    }
}
