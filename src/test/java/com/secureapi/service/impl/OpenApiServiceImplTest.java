package com.secureapi.service.impl;

import com.secureapi.exception.UpstreamFetchException;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.ApiParameter;
import com.secureapi.model.ApiSpecification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenApiServiceImplTest {

    private OpenApiServiceImpl openApiService;

    @BeforeEach
    void setUp() {
        openApiService = new OpenApiServiceImpl();
    }

    @Test
    void loadAndParseSpec_shouldParseOperationsWithTags() throws Exception {
        ApiSpecification spec = openApiService.loadAndParseSpec(fixturePath());

        assertThat(spec.getTitle()).isEqualTo("Test Vendor API");
        assertThat(spec.getServerUrls()).containsExactly("https://api.example.com/v3");
        assertThat(spec.getOperations()).hasSize(6);

        ApiOperation listDevices = spec.getOperations().get("listDevices");
        assertThat(listDevices.getHttpMethod()).isEqualTo("GET");
        assertThat(listDevices.getPath()).isEqualTo("/reporting/devices");
        assertThat(listDevices.getTags()).containsExactly("Device Reporting");
        assertThat(listDevices.getParameters()).containsExactly(new ApiParameter("pageSize", "query", false));
        assertThat(listDevices.isRequestBody()).isFalse();

        ApiOperation freeze = spec.getOperations().get("createFreezeRequest");
        assertThat(freeze.getTags()).isEmpty();
        assertThat(freeze.isRequestBody()).isTrue();
    }

    @Test
    void loadAndParseSpec_shouldStripHtmlFromDescriptions() throws Exception {
        ApiSpecification spec = openApiService.loadAndParseSpec(fixturePath());

        assertThat(spec.getOperations().get("listDevices").getDescription()).isEqualTo("Returns a paged list of devices.");
        assertThat(spec.getOperations().get("listSoftware").getDescription()).isEqualTo("List installed software");
    }

    @Test
    void loadAndParseSpec_shouldMergePathLevelParameters() throws Exception {
        ApiSpecification spec = openApiService.loadAndParseSpec(fixturePath());

        assertThat(spec.getOperations().get("getDevice").getParameters()).containsExactly(
                new ApiParameter("deviceUid", "path", true),
                new ApiParameter("X-Request-Id", "header", false));
    }

    @Test
    void loadAndParseSpec_shouldGenerateMissingOperationIds() throws Exception {
        ApiSpecification spec = openApiService.loadAndParseSpec(fixturePath());

        assertThat(spec.getOperations()).containsKey("head_reporting_devices");
        assertThat(spec.getOperations().get("head_reporting_devices").getHttpMethod()).isEqualTo("HEAD");
    }

    @Test
    void loadAndParseSpec_shouldKeepEveryOperationWhenIdsCollide() throws Exception {
        ApiSpecification spec = openApiService.loadAndParseSpec(fixturePath("colliding-operation-ids.json"));

        assertThat(spec.getOperations()).hasSize(4);
        assertThat(spec.getOperations()).containsOnlyKeys(
                "get_reporting_devices_list", "get_reporting_devices_list_2", "listSoftware", "listSoftware_2");

        ApiOperation first = spec.getOperations().get("get_reporting_devices_list");
        assertThat(first.getPath()).isEqualTo("/reporting/devices-list");
        assertThat(first.getTags()).containsExactly("Software Reporting");

        ApiOperation second = spec.getOperations().get("get_reporting_devices_list_2");
        assertThat(second.getOperationId()).isEqualTo("get_reporting_devices_list_2");
        assertThat(second.getPath()).isEqualTo("/reporting/devices/list");
        assertThat(second.getTags()).containsExactly("Device Reporting");

        assertThat(spec.getOperations().get("listSoftware").getHttpMethod()).isEqualTo("GET");
        assertThat(spec.getOperations().get("listSoftware_2").getHttpMethod()).isEqualTo("POST");
    }

    @Test
    void uniqueOperationId_shouldSkipSuffixesAlreadyTaken() {
        Map<String, ApiOperation> operations = new LinkedHashMap<>();
        operations.put("listDevices", operation("listDevices", "/reporting/devices"));
        operations.put("listDevices_2", operation("listDevices_2", "/reporting/devices-v2"));

        String operationId = OpenApiServiceImpl.uniqueOperationId(operations, operation("listDevices", "/reporting/devices-all"));

        assertThat(operationId).isEqualTo("listDevices_3");
    }

    @Test
    void loadAndParseSpec_shouldFailForMissingSource() {
        assertThrows(UpstreamFetchException.class, () -> openApiService.loadAndParseSpec("non/existent/file.json"));
    }

    @Test
    void toPlainText_shouldLeavePlainTextAndNullAlone() {
        assertThat(OpenApiServiceImpl.toPlainText("Plain text")).isEqualTo("Plain text");
        assertThat(OpenApiServiceImpl.toPlainText(null)).isNull();
    }

    private static ApiOperation operation(String id, String path) {
        ApiOperation op = new ApiOperation();
        op.setOperationId(id);
        op.setHttpMethod("GET");
        op.setPath(path);
        return op;
    }

    private String fixturePath() throws Exception {
        return fixturePath("test-openapi.json");
    }

    private String fixturePath(String name) throws Exception {
        URL resource = getClass().getClassLoader().getResource(name);
        assertThat(resource).isNotNull();
        return Paths.get(resource.toURI()).toFile().getAbsolutePath();
    }
}
