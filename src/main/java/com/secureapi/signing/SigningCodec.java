package com.secureapi.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.secureapi.exception.SecureApiException;
import com.secureapi.model.SigningCredential;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one logical HTTP request into a compact JWS (HS256) that the vendor's validation
 * endpoint accepts in place of a bearer token.
 * <p>
 * The protected header carries the request line ({@code method}, {@code uri},
 * {@code query-string}) and the signing time ({@code issuedAt}, epoch milliseconds). The payload
 * wraps the JSON body as {@code {"data": <body>}}. The codec holds no per-call state and is safe
 * to share between threads.
 */
@Slf4j
public class SigningCodec {

    public static final String API_VERSION_PREFIX = "/v3";

    static final String ALGORITHM = "HS256";
    static final String PAYLOAD_CONTENT_TYPE = "application/json";
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder BASE64URL = Base64.getUrlEncoder().withoutPadding();

    private final ObjectMapper objectMapper;
    private final ObjectWriter headerWriter;
    private final ObjectWriter payloadWriter;
    private final Clock clock;

    public SigningCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.headerWriter = objectMapper.writer().with(new LowercaseHexEscapes());
        this.payloadWriter = objectMapper.writer(new SpacedJsonPrettyPrinter())
                .with(new LowercaseHexEscapes());
        this.clock = clock;
    }

    public SigningCodec() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * Signs a request using the current time of the codec's clock.
     *
     * @see #sign(String, String, String, Object, SigningCredential, long)
     */
    public String sign(String method, String path, String queryString, Object jsonBody, SigningCredential credential) {
        return sign(method, path, queryString, jsonBody, credential, clock.millis());
    }

    /**
     * Signs a request.
     *
     * @param method         The logical HTTP method, upper-cased before use.
     * @param path           The request path; {@value #API_VERSION_PREFIX} is prepended when missing.
     * @param queryString    The complete, already encoded query string, or {@code null}.
     * @param jsonBody       The JSON body, or {@code null}. Empty or falsy bodies are signed as {@code {}}.
     * @param credential     The key id and secret.
     * @param issuedAtMillis The signing time in epoch milliseconds.
     * @return The compact serialization {@code header.payload.signature}.
     */
    public String sign(String method, String path, String queryString, Object jsonBody,
                       SigningCredential credential, long issuedAtMillis) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("HTTP method must be non-empty");
        }
        String uri = withVersionPrefix(path);

        ObjectNode header = objectMapper.createObjectNode();
        header.put("alg", ALGORITHM);
        header.put("kid", credential.keyId());
        header.put("method", method.toUpperCase(Locale.ROOT));
        header.put("content-type", PAYLOAD_CONTENT_TYPE);
        header.put("uri", uri);
        header.put("query-string", queryString == null ? "" : queryString);
        header.put("issuedAt", issuedAtMillis);

        try {
            String signingInput = BASE64URL.encodeToString(headerWriter.writeValueAsBytes(header))
                    + "." + BASE64URL.encodeToString(payload(jsonBody).getBytes(StandardCharsets.UTF_8));
            String signature = BASE64URL.encodeToString(hmac(signingInput, credential.secret()));
            String token = signingInput + "." + signature;
            log.debug("Created JWS for request: {} {}: {}", header.get("method").asText(), uri, token);
            return token;
        } catch (JsonProcessingException e) {
            throw new SecureApiException("Request body for " + method + " " + uri + " is not serializable as JSON", e);
        }
    }

    /**
     * Renders the envelope payload, {@code {"data": <body>}}, exactly as it is signed.
     * <p>
     * A body that is absent or falsy ({@code null}, an empty object or array, {@code ""},
     * {@code 0}, {@code false}) is replaced by {@code {}}.
     *
     * @param jsonBody The request body or {@code null}.
     * @return The payload text.
     * @throws JsonProcessingException if the body cannot be written as JSON.
     */
    public String payload(Object jsonBody) throws JsonProcessingException {
        JsonNode data = objectMapper.valueToTree(jsonBody);
        if (isFalsy(data)) {
            data = objectMapper.createObjectNode();
        }
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.set("data", data);
        return payloadWriter.writeValueAsString(envelope);
    }

    /**
     * Prepends {@value #API_VERSION_PREFIX} unless the path already starts with it.
     */
    public static String withVersionPrefix(String path) {
        String value = path == null ? "" : path;
        return value.startsWith(API_VERSION_PREFIX) ? value : API_VERSION_PREFIX + value;
    }

    private static boolean isFalsy(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return true;
        }
        if (data.isContainerNode()) {
            return data.isEmpty();
        }
        if (data.isBoolean()) {
            return !data.booleanValue();
        }
        if (data.isNumber()) {
            return data.isIntegralNumber() ? data.bigIntegerValue().signum() == 0 : data.doubleValue() == 0.0;
        }
        return data.isTextual() && data.textValue().isEmpty();
    }

    private static byte[] hmac(String signingInput, byte[] secret) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, MAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(MAC_ALGORITHM + " is not available", e);
        }
    }
}
