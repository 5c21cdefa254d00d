package com.secureapi.model;

import java.util.List;
import java.util.Set;
import lombok.Data;

/**
 * A simplified representation of a single API operation (e.g., a GET request to /reporting/devices).
 * This class captures what the route policy needs to admit or exclude the operation, and what
 * the tool invocation service needs to call it.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class ApiOperation {

    /**
     * A unique identifier for the operation, taken from the document's {@code operationId} or
     * generated from the method and path. Used as the tool name.
     */
    private String operationId;

    /**
     * The HTTP method for this operation, always upper-case (e.g., "GET", "POST", "HEAD").
     */
    private String httpMethod;

    /**
     * The URL path as declared in the document, without the API version prefix
     * (e.g., "/reporting/devices/{deviceUid}").
     */
    private String path;

    /**
     * Plain-text description of the operation, with any HTML markup removed.
     */
    private String description;

    /**
     * The tags declared on the operation. Each tag becomes a feature group.
     */
    private Set<String> tags;

    /**
     * The parameters that this operation accepts.
     *
     * @see ApiParameter
     */
    private List<ApiParameter> parameters;

    /**
     * Whether the operation declares a JSON request body.
     */
    private boolean requestBody;
}
