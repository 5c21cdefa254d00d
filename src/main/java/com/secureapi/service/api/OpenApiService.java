package com.secureapi.service.api;

import com.secureapi.model.ApiSpecification;

public interface OpenApiService {
    /**
     * Loads and parses an OpenAPI specification from a given source URL or file path.
     *
     * @param source The URL or local file path of the OpenAPI specification.
     * @return A structured, internal representation of the API specification.
     * @throws com.secureapi.exception.UpstreamFetchException if the document cannot be read or parsed.
     */
    ApiSpecification loadAndParseSpec(String source);
}
