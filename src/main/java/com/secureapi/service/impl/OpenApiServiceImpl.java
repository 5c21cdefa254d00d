package com.secureapi.service.impl;

import com.secureapi.exception.UpstreamFetchException;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.ApiParameter;
import com.secureapi.model.ApiSpecification;
import com.secureapi.service.api.OpenApiService;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiServiceImpl implements OpenApiService {

    /**
     * {@inheritDoc}
     * This implementation uses the swagger-parser library to load and parse the spec, with
     * references resolved. Every path and operation is converted into the simplified internal
     * model; HTML in descriptions is reduced to plain text to keep tool descriptions short.
     */
    @Override
    public ApiSpecification loadAndParseSpec(String source) {
        log.info("Loading and parsing OpenAPI spec from: {}", source);
        ParseOptions options = new ParseOptions();
        options.setResolve(true);

        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readLocation(source, null, options);
        } catch (RuntimeException e) {
            log.error("Failed to fetch OpenAPI spec from {}: {}", source, e.getMessage());
            throw new UpstreamFetchException("Failed to load the OpenAPI specification from: " + source, e);
        }
        OpenAPI openAPI = result == null ? null : result.getOpenAPI();
        if (openAPI == null || openAPI.getPaths() == null) {
            List<String> messages = result == null || result.getMessages() == null ? List.of() : result.getMessages();
            log.error("Failed to parse OpenAPI spec from {}: {}", source, messages);
            throw new UpstreamFetchException("Failed to load or parse the OpenAPI specification from the source: "
                    + source + " " + messages);
        }

        ApiSpecification spec = new ApiSpecification();
        spec.setTitle(openAPI.getInfo() != null ? openAPI.getInfo().getTitle() : null);
        spec.setServerUrls(openAPI.getServers() == null ? List.of()
                : openAPI.getServers().stream().map(Server::getUrl).collect(Collectors.toList()));

        Map<String, ApiOperation> operations = new LinkedHashMap<>();
        openAPI.getPaths().forEach((path, pathItem) ->
                pathItem.readOperationsMap().forEach((method, operation) -> {
                    ApiOperation apiOp = createApiOperation(method, operation, path, pathItem);
                    String operationId = uniqueOperationId(operations, apiOp);
                    apiOp.setOperationId(operationId);
                    operations.put(operationId, apiOp);
                }));

        spec.setOperations(operations);
        log.info("Successfully parsed {} operations from the specification.", operations.size());
        return spec;
    }

    /**
     * Returns the operation's id, or the id with the first free numeric suffix ({@code _2},
     * {@code _3}, ...) when an earlier operation already took it. Generated ids collide easily
     * because {@code /} and {@code -} both map to {@code _}.
     */
    static String uniqueOperationId(Map<String, ApiOperation> operations, ApiOperation apiOp) {
        String baseId = apiOp.getOperationId();
        if (!operations.containsKey(baseId)) {
            return baseId;
        }
        int suffix = 2;
        while (operations.containsKey(baseId + "_" + suffix)) {
            suffix++;
        }
        String operationId = baseId + "_" + suffix;
        ApiOperation existing = operations.get(baseId);
        log.warn("Operation id '{}' of {} {} is already used by {} {}; registering it as '{}'",
                baseId, apiOp.getHttpMethod(), apiOp.getPath(), existing.getHttpMethod(), existing.getPath(), operationId);
        return operationId;
    }

    private ApiOperation createApiOperation(PathItem.HttpMethod method, Operation operation, String path, PathItem pathItem) {
        ApiOperation apiOp = new ApiOperation();

        // Use the operationId if present, otherwise generate a predictable one
        String operationId = operation.getOperationId() != null
                ? operation.getOperationId()
                : generateOperationId(method.name(), path);

        apiOp.setOperationId(operationId);
        apiOp.setHttpMethod(method.name());
        apiOp.setPath(path);
        apiOp.setDescription(toPlainText(operation.getDescription() != null ? operation.getDescription() : operation.getSummary()));
        apiOp.setTags(operation.getTags() == null ? Collections.emptySet() : new LinkedHashSet<>(operation.getTags()));
        apiOp.setRequestBody(operation.getRequestBody() != null);

        List<ApiParameter> parameters = new ArrayList<>();
        if (pathItem.getParameters() != null) {
            pathItem.getParameters().forEach(p -> addParameter(parameters, p));
        }
        if (operation.getParameters() != null) {
            operation.getParameters().forEach(p -> addParameter(parameters, p));
        }
        apiOp.setParameters(parameters);
        return apiOp;
    }

    private void addParameter(List<ApiParameter> parameters, Parameter parameter) {
        if (parameter.getName() == null || parameter.getIn() == null) {
            log.warn("Skipping unresolved parameter {}", parameter.get$ref());
            return;
        }
        // Operation-level parameters override path-level ones with the same name and location
        parameters.removeIf(p -> p.getName().equals(parameter.getName()) && p.getIn().equals(parameter.getIn()));
        parameters.add(new ApiParameter(parameter.getName(), parameter.getIn(),
                Boolean.TRUE.equals(parameter.getRequired())));
    }

    static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return html;
        }
        return Jsoup.parse(html).text().strip();
    }

    private String generateOperationId(String httpMethod, String path) {
        String sanitizedPath = path
                .replaceAll("\\{", "by_")
                .replaceAll("[{}/-]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        return httpMethod.toLowerCase() + "_" + sanitizedPath;
    }
}
