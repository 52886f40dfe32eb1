package openauth.adapter.out.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import openauth.core.model.client.HttpFetchResponse;
import openauth.core.port.out.HttpFetcher;

/**
 * {@link HttpFetcher} backed by the Vert.x web client.
 */
public class VertxHttpFetcher implements HttpFetcher {

    private static final Logger LOG = Logger.getLogger(VertxHttpFetcher.class);

    private final WebClient webClient;
    private final long timeoutMillis;

    public VertxHttpFetcher(Vertx vertx, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.timeoutMillis = timeout.toMillis();
    }

    @Override
    public Uni<HttpFetchResponse> get(String url) {
        LOG.debugf("GET %s", url);
        return webClient
                .getAbs(url)
                .timeout(timeoutMillis)
                .putHeader("Accept", "application/json")
                .send()
                .map(VertxHttpFetcher::toResponse);
    }

    @Override
    public Uni<HttpFetchResponse> postForm(String url, Map<String, String> form) {
        LOG.debugf("POST %s", url);
        return webClient
                .postAbs(url)
                .timeout(timeoutMillis)
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(encodeForm(form)))
                .map(VertxHttpFetcher::toResponse);
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue() == null ? "" : e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static HttpFetchResponse toResponse(HttpResponse<Buffer> response) {
        return new HttpFetchResponse(response.statusCode(), response.bodyAsString());
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
