package com.secureapi.service.impl;

import com.secureapi.flags.FeatureFlagRegistry;
import com.secureapi.flags.GroupExtractor;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.ApiSpecification;
import com.secureapi.model.RouteKind;
import com.secureapi.model.ToolDefinition;
import com.secureapi.policy.RoutePolicyEngine;
import com.secureapi.service.api.ToolCatalogService;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the tool catalog from the loaded specification. The catalog map is assembled
 * privately and published once through a volatile field; readers never see a partial set.
 */
@Service
@Slf4j
public class ToolCatalogServiceImpl implements ToolCatalogService {

    private final GroupExtractor groupExtractor;
    private final RoutePolicyEngine routePolicyEngine;
    private final FeatureFlagRegistry featureFlagRegistry;

    private volatile Map<String, ToolDefinition> tools;

    public ToolCatalogServiceImpl(GroupExtractor groupExtractor,
                                  RoutePolicyEngine routePolicyEngine,
                                  FeatureFlagRegistry featureFlagRegistry) {
        this.groupExtractor = groupExtractor;
        this.routePolicyEngine = routePolicyEngine;
        this.featureFlagRegistry = featureFlagRegistry;
    }

    @Override
    public void initialize(ApiSpecification spec) {
        Collection<ApiOperation> operations = spec.getOperations().values();
        groupExtractor.extract(operations);

        Map<String, ToolDefinition> admitted = new LinkedHashMap<>();
        int excluded = 0;
        for (ApiOperation operation : operations) {
            RouteKind kind = routePolicyEngine.decide(operation, RouteKind.TOOL);
            if (kind == RouteKind.EXCLUDED) {
                excluded++;
                continue;
            }
            admitted.put(operation.getOperationId(), new ToolDefinition(operation.getOperationId(), kind, operation));
        }
        tools = Collections.unmodifiableMap(admitted);

        log.info("Exposing {} of {} operations ({} excluded). Enabled groups: {}, disabled groups: {}",
                admitted.size(), operations.size(), excluded,
                featureFlagRegistry.enabledGroups(), featureFlagRegistry.disabledGroups());
    }

    @Override
    public boolean isInitialized() {
        return tools != null;
    }

    @Override
    public Collection<ToolDefinition> tools() {
        Map<String, ToolDefinition> current = tools;
        return current == null ? Collections.emptyList() : current.values();
    }

    @Override
    public Optional<ToolDefinition> find(String toolName) {
        Map<String, ToolDefinition> current = tools;
        return current == null ? Optional.empty() : Optional.ofNullable(current.get(toolName));
    }

    @Override
    public RouteKind explain(String path, String method) {
        return routePolicyEngine.decide(path, method, RouteKind.TOOL);
    }
}
