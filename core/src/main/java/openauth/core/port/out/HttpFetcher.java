package openauth.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import openauth.core.model.client.HttpFetchResponse;

/**
 * HTTP transport used by the OAuth client.
 *
 * <p>Callers may supply their own implementation (for tests, proxies, or a different HTTP
 * stack). Non-2xx responses MUST be returned as responses, not failures; the {@code Uni} fails
 * only for transport errors.
 */
public interface HttpFetcher {

    /**
     * Perform a GET request.
     *
     * @param url absolute URL
     */
    Uni<HttpFetchResponse> get(String url);

    /**
     * POST an {@code application/x-www-form-urlencoded} body.
     *
     * @param url  absolute URL
     * @param form form fields, encoded in iteration order
     */
    Uni<HttpFetchResponse> postForm(String url, Map<String, String> form);
}
