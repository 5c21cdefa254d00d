package com.secureapi.service.impl;

import com.secureapi.exception.SecureApiException;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.ApiParameter;
import com.secureapi.model.ApiRequest;
import com.secureapi.model.RouteKind;
import com.secureapi.model.ToolDefinition;
import com.secureapi.service.api.ToolCatalogService;
import com.secureapi.signing.SigningHttpClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolInvocationServiceImplTest {

    @Mock
    private ToolCatalogService toolCatalogService;

    @Mock
    private SigningHttpClient signingHttpClient;

    private ToolInvocationServiceImpl invocationService;

    @BeforeEach
    void setUp() {
        RetryConfig config = RetryConfig.<ResponseEntity<String>>custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(10))
                .retryOnResult(response -> response.getStatusCode().value() == 429)
                .retryOnException(e -> false)
                .build();
        invocationService = new ToolInvocationServiceImpl(toolCatalogService, signingHttpClient, Retry.of("test", config));
    }

    @Test
    void invoke_shouldRejectUnknownTool() {
        when(toolCatalogService.find(anyString())).thenReturn(Optional.empty());

        assertThrows(SecureApiException.class, () -> invocationService.invoke("listSoftware", Map.of()));
        verify(signingHttpClient, never()).request(any());
    }

    @Test
    void invoke_shouldFillPathAndHeaderParameters() {
        expose(getDevice());
        when(signingHttpClient.request(any())).thenReturn(Mono.just(ResponseEntity.ok("{}")));

        ResponseEntity<String> response = invocationService.invoke("getDevice",
                Map.of("deviceUid", "abc 1", "X-Request-Id", "r-1")).block();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
        verify(signingHttpClient).request(captor.capture());
        ApiRequest request = captor.getValue();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/reporting/devices/abc%201");
        assertThat(request.headers()).containsExactly(Map.entry("X-Request-Id", "r-1"));
        assertThat(request.params()).isEmpty();
        assertThat(request.body()).isNull();
    }

    @Test
    void buildRequest_shouldRequirePathParameters() {
        assertThrows(SecureApiException.class, () -> invocationService.buildRequest(getDevice(), Map.of()));
    }

    @Test
    void buildRequest_shouldSendQueryParametersAsParams() {
        ApiOperation listDevices = operation("listDevices", "GET", "/reporting/devices", false,
                new ApiParameter("pageSize", "query", false));

        ApiRequest request = invocationService.buildRequest(listDevices, Map.of("pageSize", 10, "unknown", "x"));

        assertThat(request.params()).containsOnlyKeys("pageSize");
        assertThat(request.params().get("pageSize")).isEqualTo(10);
        assertThat(request.body()).isNull();
    }

    @Test
    void buildRequest_shouldCollectUndeclaredArgumentsIntoBody() {
        ApiOperation freeze = operation("createFreezeRequest", "POST", "/device-freeze/requests", true);

        ApiRequest request = invocationService.buildRequest(freeze, Map.of("name", "lost", "deviceUids", List.of("d1")));

        assertThat(request.body()).isEqualTo(Map.of("name", "lost", "deviceUids", List.of("d1")));
    }

    @Test
    void buildRequest_shouldUnwrapLoneBodyArgument() {
        ApiOperation freeze = operation("createFreezeRequest", "POST", "/device-freeze/requests", true);

        ApiRequest request = invocationService.buildRequest(freeze, Map.of("body", Map.of("name", "lost")));

        assertThat(request.body()).isEqualTo(Map.of("name", "lost"));
    }

    @Test
    void invoke_shouldRetryThrottledCallsAboveSigningClient() {
        expose(getDevice());
        AtomicInteger attempts = new AtomicInteger();
        when(signingHttpClient.request(any())).thenReturn(Mono.fromSupplier(() ->
                attempts.incrementAndGet() == 1
                        ? ResponseEntity.status(429).body("slow down")
                        : ResponseEntity.ok("{}")));

        StepVerifier.create(invocationService.invoke("getDevice", Map.of("deviceUid", "1")))
                .assertNext(response -> assertThat(response.getStatusCode().value()).isEqualTo(200))
                .verifyComplete();
        assertThat(attempts).hasValue(2);
    }

    @Test
    void invoke_shouldNotRetryTransportErrors() {
        expose(getDevice());
        AtomicInteger attempts = new AtomicInteger();
        when(signingHttpClient.request(any())).thenReturn(Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new IllegalStateException("connection refused"));
        }));

        StepVerifier.create(invocationService.invoke("getDevice", Map.of("deviceUid", "1")))
                .expectErrorMessage("connection refused")
                .verify();
        assertThat(attempts).hasValue(1);
    }

    private void expose(ApiOperation operation) {
        when(toolCatalogService.find(operation.getOperationId()))
                .thenReturn(Optional.of(new ToolDefinition(operation.getOperationId(), RouteKind.TOOL, operation)));
    }

    private static ApiOperation getDevice() {
        return operation("getDevice", "GET", "/reporting/devices/{deviceUid}", false,
                new ApiParameter("deviceUid", "path", true),
                new ApiParameter("X-Request-Id", "header", false));
    }

    private static ApiOperation operation(String id, String method, String path, boolean requestBody, ApiParameter... parameters) {
        ApiOperation op = new ApiOperation();
        op.setOperationId(id);
        op.setHttpMethod(method);
        op.setPath(path);
        op.setTags(Set.of());
        op.setRequestBody(requestBody);
        op.setParameters(List.of(parameters));
        return op;
    }
}
