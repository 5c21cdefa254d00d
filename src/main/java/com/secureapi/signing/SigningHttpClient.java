package com.secureapi.signing;

import com.secureapi.exception.ConfigurationException;
import com.secureapi.model.ApiRequest;
import com.secureapi.model.RequestOptions;
import com.secureapi.model.SigningCredential;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * An HTTP client whose callers see an ordinary method/path/body-in, response-out contract, while
 * every request is actually signed and sent to the vendor's validation endpoint.
 * <p>
 * For each call the logical request is normalized ({@value SigningCodec#API_VERSION_PREFIX}
 * prefix, merged query string), signed by the {@link SigningCodec}, and POSTed as
 * {@code text/plain} to the validation endpoint. The logical method only travels inside the
 * envelope. The response is handed back untouched, whatever its status; network errors and
 * timeouts surface as the WebClient or Reactor exception. Nothing is retried here.
 * <p>
 * The client wraps two {@link WebClient}s (redirects off and on) instead of extending one. It
 * holds no mutable state, so any number of calls may be in flight at once.
 */
@Slf4j
public class SigningHttpClient {

    public static final String VALIDATION_PATH = "/jws/validate";

    private final SigningCodec codec;
    private final SigningCredential credential;
    private final String validationEndpoint;
    private final Duration defaultTimeout;
    private final WebClient webClient;
    private final WebClient redirectingWebClient;

    /**
     * Constructs the client.
     *
     * @param webClientBuilder The builder the underlying transports are derived from.
     * @param codec            The envelope codec.
     * @param credential       The signing credential.
     * @param apiHost          The vendor API base URL; the validation endpoint is
     *                         {@code apiHost + }{@value #VALIDATION_PATH}.
     * @param defaultTimeout   Timeout applied when a call does not set its own.
     * @throws ConfigurationException if the credential or host is missing or malformed.
     */
    public SigningHttpClient(WebClient.Builder webClientBuilder,
                             SigningCodec codec,
                             SigningCredential credential,
                             String apiHost,
                             Duration defaultTimeout) {
        if (credential == null) {
            throw new ConfigurationException("Signing credential is missing.");
        }
        this.codec = Objects.requireNonNull(codec, "codec");
        this.credential = credential;
        this.validationEndpoint = validationEndpoint(apiHost);
        this.defaultTimeout = defaultTimeout;
        this.webClient = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(false)))
                .build();
        this.redirectingWebClient = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .build();
    }

    public String getValidationEndpoint() {
        return validationEndpoint;
    }

    /**
     * Signs the request and sends it to the validation endpoint.
     * <p>
     * Nothing happens until the returned {@link Mono} is subscribed. Every subscription signs
     * anew, so a resubscribing retry never replays an old {@code issuedAt}. Cancelling the
     * subscription cancels only this exchange.
     *
     * @param request The logical request.
     * @return The raw response, for any status code.
     */
    public Mono<ResponseEntity<String>> request(ApiRequest request) {
        return Mono.defer(() -> {
            String url = SigningCodec.withVersionPrefix(request.path());
            log.debug("Making request: {} {}", request.method(), url);

            int queryStart = url.indexOf('?');
            String path = queryStart < 0 ? url : url.substring(0, queryStart);
            String queryString = mergeQuery(queryStart < 0 ? "" : url.substring(queryStart + 1), request.params());

            String envelope = codec.sign(request.method(), path, queryString, request.body(), credential);
            String endpoint = request.endpointOverride() != null ? request.endpointOverride() : validationEndpoint;
            RequestOptions options = request.options();
            WebClient transport = Boolean.TRUE.equals(options.followRedirects()) ? redirectingWebClient : webClient;

            Mono<ResponseEntity<String>> exchange = transport.post()
                    .uri(URI.create(endpoint))
                    .headers(outbound -> applyHeaders(outbound, request.headers()))
                    .cookies(cookies -> options.cookies().forEach(cookies::add))
                    .bodyValue(envelope.getBytes(StandardCharsets.UTF_8))
                    .exchangeToMono(response -> response.toEntity(String.class));

            Duration timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
            return timeout != null ? exchange.timeout(timeout) : exchange;
        });
    }

    public Mono<ResponseEntity<String>> get(String path) {
        return request(ApiRequest.builder().method("GET").path(path).build());
    }

    public Mono<ResponseEntity<String>> get(String path, Map<String, ?> params) {
        return request(ApiRequest.builder().method("GET").path(path).params(params).build());
    }

    public Mono<ResponseEntity<String>> post(String path, Object body) {
        return request(ApiRequest.builder().method("POST").path(path).body(body).build());
    }

    public Mono<ResponseEntity<String>> put(String path, Object body) {
        return request(ApiRequest.builder().method("PUT").path(path).body(body).build());
    }

    public Mono<ResponseEntity<String>> patch(String path, Object body) {
        return request(ApiRequest.builder().method("PATCH").path(path).body(body).build());
    }

    public Mono<ResponseEntity<String>> delete(String path) {
        return request(ApiRequest.builder().method("DELETE").path(path).build());
    }

    /**
     * Appends URL-encoded {@code params} to {@code queryString}, joined with {@code &}.
     * Spaces are encoded as {@code +}, as in HTML form encoding. Only letters, digits and
     * {@code _ . - ~} stay unencoded; the signature covers these exact bytes.
     */
    static String mergeQuery(String queryString, Map<String, ?> params) {
        String existing = queryString == null ? "" : queryString;
        if (params == null || params.isEmpty()) {
            return existing;
        }
        String additional = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
                .collect(Collectors.joining("&"));
        return existing.isEmpty() ? additional : existing + "&" + additional;
    }

    private static void applyHeaders(HttpHeaders outbound, Map<String, String> extraHeaders) {
        extraHeaders.forEach((name, value) -> {
            if (!HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)) {
                outbound.set(name, value);
            }
        });
        outbound.setContentType(MediaType.TEXT_PLAIN);
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static String validationEndpoint(String apiHost) {
        if (apiHost == null || apiHost.isBlank()) {
            throw new ConfigurationException("API host is missing. Set API_HOST.");
        }
        String base = apiHost.endsWith("/") ? apiHost.substring(0, apiHost.length() - 1) : apiHost;
        URI uri;
        try {
            uri = URI.create(base + VALIDATION_PATH);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("API host '" + apiHost + "' is not a valid URL.", e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException("API host '" + apiHost + "' must be an absolute http(s) URL.");
        }
        return uri.toString();
    }
}
