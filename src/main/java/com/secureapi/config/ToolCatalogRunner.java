package com.secureapi.config;

import com.secureapi.model.ApiSpecification;
import com.secureapi.service.api.OpenApiService;
import com.secureapi.service.api.ToolCatalogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the vendor's OpenAPI document on application startup and builds the tool catalog from it,
 * before the shell accepts any command.
 * <p>
 * There is no partial start: if the document cannot be fetched or parsed, the
 * {@link com.secureapi.exception.UpstreamFetchException} escapes this runner and Spring Boot
 * aborts.
 */
@Slf4j
@Component
@Profile("!test") // Ensures this does not run during tests
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ToolCatalogRunner implements CommandLineRunner {

    @Value("${secure-api.host}")
    private String apiHost;

    @Value("${secure-api.openapi-path:/api-doc/spec/openapi.json}")
    private String openApiPath;

    private final OpenApiService openApiService;
    private final ToolCatalogService toolCatalogService;

    public ToolCatalogRunner(OpenApiService openApiService, ToolCatalogService toolCatalogService) {
        this.openApiService = openApiService;
        this.toolCatalogService = toolCatalogService;
    }

    @Override
    public void run(String... args) {
        String specUrl = apiHost + openApiPath;
        log.info("Using OpenAPI spec from: {}", specUrl);
        ApiSpecification spec = openApiService.loadAndParseSpec(specUrl);
        toolCatalogService.initialize(spec);
        log.info("Tool catalog ready with {} tools", toolCatalogService.tools().size());
    }
}
