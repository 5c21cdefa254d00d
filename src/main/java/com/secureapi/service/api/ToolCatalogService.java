package com.secureapi.service.api;

import com.secureapi.model.ApiSpecification;
import com.secureapi.model.RouteKind;
import com.secureapi.model.ToolDefinition;
import java.util.Collection;
import java.util.Optional;

/**
 * Holds the set of operations exposed as tools. It is built once from the loaded specification:
 * feature groups are extracted, every operation is run through the route policy, and the
 * survivors are published together.
 */
public interface ToolCatalogService {

    /**
     * Builds the catalog. May only be called once.
     *
     * @param spec The fully loaded specification.
     */
    void initialize(ApiSpecification spec);

    boolean isInitialized();

    /**
     * @return The exposed tools in document order. Empty before {@link #initialize}.
     */
    Collection<ToolDefinition> tools();

    Optional<ToolDefinition> find(String toolName);

    /**
     * Runs a single (path, method) pair through the route policy, with {@link RouteKind#TOOL}
     * as the default classification.
     */
    RouteKind explain(String path, String method);
}
