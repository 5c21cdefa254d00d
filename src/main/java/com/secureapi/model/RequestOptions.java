package com.secureapi.model;

import java.time.Duration;
import java.util.Map;

/**
 * Transport-level settings forwarded unchanged to the underlying HTTP client.
 *
 * @param cookies         Cookies to send with the request, may be empty.
 * @param followRedirects Whether redirects are followed, {@code null} for the client default.
 * @param timeout         Per-call timeout, {@code null} for the client default.
 */
public record RequestOptions(Map<String, String> cookies, Boolean followRedirects, Duration timeout) {

    public static final RequestOptions DEFAULTS = new RequestOptions(Map.of(), null, null);

    public RequestOptions {
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public static RequestOptions withTimeout(Duration timeout) {
        return new RequestOptions(Map.of(), null, timeout);
    }
}
