package com.secureapi.model;

import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * A simplified, curated representation of the vendor's OpenAPI document. Only what the feature
 * groups, the route policy and the tool invocation need is kept.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class ApiSpecification {

    /**
     * The document's {@code info.title}, shown by the shell.
     */
    private String title;

    /**
     * All operations declared by the document, keyed by their unique {@code operationId}, in
     * document order.
     */
    private Map<String, ApiOperation> operations;

    /**
     * Server URLs declared by the document. Informational only: every call is redirected to
     * the signature validation endpoint.
     */
    private List<String> serverUrls;
}
