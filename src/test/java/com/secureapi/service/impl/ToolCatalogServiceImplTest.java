package com.secureapi.service.impl;

import com.secureapi.flags.FeatureFlagLoader;
import com.secureapi.flags.FeatureFlagRegistry;
import com.secureapi.flags.GroupExtractor;
import com.secureapi.model.ApiSpecification;
import com.secureapi.model.RouteKind;
import com.secureapi.model.ToolDefinition;
import com.secureapi.policy.RoutePolicyEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCatalogServiceImplTest {

    private static ApiSpecification spec;

    @BeforeAll
    static void loadSpec() throws Exception {
        URL resource = ToolCatalogServiceImplTest.class.getClassLoader().getResource("test-openapi.json");
        assertThat(resource).isNotNull();
        spec = new OpenApiServiceImpl().loadAndParseSpec(Paths.get(resource.toURI()).toFile().getAbsolutePath());
    }

    @Test
    void initialize_shouldExposeOnlyDefaultGroupAndUngroupedOperations() {
        ToolCatalogServiceImpl catalog = catalog(Map.of(), true);

        catalog.initialize(spec);

        assertThat(catalog.isInitialized()).isTrue();
        assertThat(catalog.tools()).extracting(ToolDefinition::name).containsExactly(
                "listDevices", "head_reporting_devices", "getDevice", "createFreezeRequest");
        assertThat(catalog.find("getDevice")).get().extracting(ToolDefinition::kind).isEqualTo(RouteKind.TOOL);
        assertThat(catalog.find("listSoftware")).isEmpty();
        assertThat(catalog.find("queryDevicesAdvanced")).isEmpty();
        assertThat(catalog.explain("/reporting/software", "GET")).isEqualTo(RouteKind.EXCLUDED);
        assertThat(catalog.explain("/reporting/devices/{deviceUid}", "GET")).isEqualTo(RouteKind.TOOL);
    }

    @Test
    void initialize_shouldFollowExplicitFlagsInsteadOfDefault() {
        ToolCatalogServiceImpl catalog = catalog(Map.of("ABS_FEATURE_SOFTWARE_REPORTING", "enabled"), true);

        catalog.initialize(spec);

        assertThat(catalog.tools()).extracting(ToolDefinition::name)
                .containsExactly("listSoftware", "createFreezeRequest");
    }

    @Test
    void initialize_shouldExposeAdvancedOperationsWhenBlocklistDisabled() {
        ToolCatalogServiceImpl catalog = catalog(Map.of(), false);

        catalog.initialize(spec);

        assertThat(catalog.find("queryDevicesAdvanced")).isPresent();
    }

    @Test
    void tools_shouldBeEmptyBeforeInitialization() {
        ToolCatalogServiceImpl catalog = catalog(Map.of(), true);

        assertThat(catalog.isInitialized()).isFalse();
        assertThat(catalog.tools()).isEmpty();
        assertThat(catalog.find("listDevices")).isEmpty();
    }

    private static ToolCatalogServiceImpl catalog(Map<String, String> environment, boolean blocklist) {
        FeatureFlagRegistry registry = new FeatureFlagRegistry(FeatureFlagLoader.fromEnvironment(
                environment, FeatureFlagLoader.DEFAULT_PREFIX, FeatureFlagLoader.DEFAULT_GROUP));
        return new ToolCatalogServiceImpl(new GroupExtractor(registry), new RoutePolicyEngine(registry, blocklist), registry);
    }
}
