package com.secureapi.service.impl;

import com.secureapi.exception.SecureApiException;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.ApiParameter;
import com.secureapi.model.ApiRequest;
import com.secureapi.model.ToolDefinition;
import com.secureapi.service.api.ToolCatalogService;
import com.secureapi.service.api.ToolInvocationService;
import com.secureapi.signing.SigningHttpClient;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

/**
 * Maps tool arguments onto the operation's declared parameters and sends the call through the
 * {@link SigningHttpClient}.
 * <p>
 * Path arguments fill {@code {name}} placeholders, query arguments become query parameters,
 * header arguments become extra headers. Everything else is the JSON body; a lone {@code body}
 * argument is sent as the body itself. Retries on throttling responses happen here, above the
 * signing client, and each attempt is signed afresh.
 */
@Service
@Slf4j
public class ToolInvocationServiceImpl implements ToolInvocationService {

    static final String BODY_ARGUMENT = "body";

    private final ToolCatalogService toolCatalogService;
    private final SigningHttpClient signingHttpClient;
    private final Retry toolCallRetry;

    public ToolInvocationServiceImpl(ToolCatalogService toolCatalogService,
                                     SigningHttpClient signingHttpClient,
                                     Retry toolCallRetry) {
        this.toolCatalogService = toolCatalogService;
        this.signingHttpClient = signingHttpClient;
        this.toolCallRetry = toolCallRetry;
    }

    @Override
    public Mono<ResponseEntity<String>> invoke(String toolName, Map<String, Object> arguments) {
        ToolDefinition tool = toolCatalogService.find(toolName)
                .orElseThrow(() -> new SecureApiException("No exposed tool named '" + toolName + "'"));
        ApiRequest request = buildRequest(tool.operation(), arguments == null ? Map.of() : arguments);
        log.info("Invoking tool {}: {} {}", toolName, request.method(), request.path());
        return signingHttpClient.request(request)
                .transform(RetryOperator.of(toolCallRetry));
    }

    ApiRequest buildRequest(ApiOperation operation, Map<String, Object> arguments) {
        Map<String, Object> remaining = new LinkedHashMap<>(arguments);
        Map<String, Object> query = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        String path = operation.getPath();

        for (ApiParameter parameter : operation.getParameters()) {
            Object value = remaining.remove(parameter.getName());
            if (value == null) {
                if (parameter.isRequired() && "path".equals(parameter.getIn())) {
                    throw new SecureApiException("Tool " + operation.getOperationId()
                            + " requires path parameter '" + parameter.getName() + "'");
                }
                continue;
            }
            switch (parameter.getIn()) {
                case "path" -> path = path.replace("{" + parameter.getName() + "}",
                        UriUtils.encodePathSegment(String.valueOf(value), StandardCharsets.UTF_8));
                case "query" -> query.put(parameter.getName(), value);
                case "header" -> headers.put(parameter.getName(), String.valueOf(value));
                default -> log.debug("Ignoring {} parameter '{}'", parameter.getIn(), parameter.getName());
            }
        }

        Object body = null;
        if (!remaining.isEmpty()) {
            if (operation.isRequestBody()) {
                body = remaining.size() == 1 && remaining.containsKey(BODY_ARGUMENT)
                        ? remaining.get(BODY_ARGUMENT)
                        : remaining;
            } else {
                log.warn("Tool {} takes no request body, ignoring arguments {}", operation.getOperationId(), remaining.keySet());
            }
        }

        return ApiRequest.builder()
                .method(operation.getHttpMethod())
                .path(path)
                .params(query)
                .headers(headers)
                .body(body)
                .build();
    }
}
