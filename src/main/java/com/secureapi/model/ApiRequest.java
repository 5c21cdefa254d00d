package com.secureapi.model;

import java.util.Map;
import lombok.Builder;

/**
 * A logical HTTP request as a caller sees it, before it is signed and redirected.
 *
 * @param method           The logical HTTP method, carried inside the signed envelope.
 * @param path             The request path, optionally with an embedded query string.
 * @param params           Additional query parameters, URL-encoded and appended.
 * @param body             The JSON body (any Jackson-serializable value), or {@code null}.
 * @param headers          Extra headers for the outbound request.
 * @param endpointOverride Destination to use instead of the configured validation endpoint.
 * @param options          Transport settings.
 */
@Builder
public record ApiRequest(String method,
                         String path,
                         Map<String, ?> params,
                         Object body,
                         Map<String, String> headers,
                         String endpointOverride,
                         RequestOptions options) {

    public ApiRequest {
        params = params == null ? Map.of() : params;
        headers = headers == null ? Map.of() : headers;
        options = options == null ? RequestOptions.DEFAULTS : options;
    }
}
