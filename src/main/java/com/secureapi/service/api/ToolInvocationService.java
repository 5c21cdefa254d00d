package com.secureapi.service.api;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

public interface ToolInvocationService {

    /**
     * Calls an exposed tool through the signing client.
     *
     * @param toolName  The tool name, as listed by {@link ToolCatalogService#tools()}.
     * @param arguments Argument values keyed by parameter name; arguments that are not declared
     *                  parameters form the JSON request body.
     * @return The raw response of the validation endpoint.
     * @throws com.secureapi.exception.SecureApiException if no exposed tool has that name or a
     *                                                    required path parameter is missing.
     */
    Mono<ResponseEntity<String>> invoke(String toolName, Map<String, Object> arguments);
}
