package com.secureapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secureapi.flags.FeatureFlagLoader;
import com.secureapi.flags.FeatureFlagRegistry;
import com.secureapi.flags.GroupExtractor;
import com.secureapi.model.SigningCredential;
import com.secureapi.policy.RoutePolicyEngine;
import com.secureapi.signing.SigningCodec;
import com.secureapi.signing.SigningHttpClient;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * A Spring configuration class that wires the signing client, the feature flag registry and the
 * route policy from application properties. Every collaborator is an explicitly constructed bean;
 * nothing reads the environment after startup.
 * <p>
 * A missing key id, secret or host fails bean creation with a
 * {@link com.secureapi.exception.ConfigurationException}, which stops the application.
 */
@Configuration
public class SecureApiConfig {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 503);

    @Bean
    public SigningCredential signingCredential(@Value("${secure-api.key:}") String apiKey,
                                               @Value("${secure-api.secret:}") String apiSecret) {
        return SigningCredential.of(apiKey, apiSecret);
    }

    @Bean
    public SigningCodec signingCodec(ObjectMapper objectMapper) {
        return new SigningCodec(objectMapper, Clock.systemUTC());
    }

    @Bean
    public SigningHttpClient signingHttpClient(WebClient.Builder webClientBuilder,
                                               SigningCodec signingCodec,
                                               SigningCredential signingCredential,
                                               @Value("${secure-api.host}") String apiHost,
                                               @Value("${secure-api.http.timeout-seconds:30}") long timeoutSeconds) {
        return new SigningHttpClient(webClientBuilder, signingCodec, signingCredential, apiHost,
                Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public FeatureFlagRegistry featureFlagRegistry(@Value("${secure-api.features.prefix:" + FeatureFlagLoader.DEFAULT_PREFIX + "}") String prefix,
                                                   @Value("${secure-api.features.default-group:" + FeatureFlagLoader.DEFAULT_GROUP + "}") String defaultGroup) {
        return new FeatureFlagRegistry(FeatureFlagLoader.fromEnvironment(System.getenv(), prefix, defaultGroup));
    }

    @Bean
    public GroupExtractor groupExtractor(FeatureFlagRegistry featureFlagRegistry) {
        return new GroupExtractor(featureFlagRegistry);
    }

    @Bean
    public RoutePolicyEngine routePolicyEngine(FeatureFlagRegistry featureFlagRegistry,
                                               @Value("${secure-api.blocklist.advanced-disabled:false}") boolean advancedBlocklistDisabled) {
        return new RoutePolicyEngine(featureFlagRegistry, !advancedBlocklistDisabled);
    }

    /**
     * Creates the retry policy applied to tool calls, above the signing client.
     * <p>
     * Calls answered with HTTP 429 (Too Many Requests) or HTTP 503 (Service Unavailable) are
     * retried with exponential backoff starting at 500ms. Transport exceptions are never retried.
     * With the default of one attempt the policy is a pass-through.
     *
     * @param maxAttempts Total attempts per tool call, including the first.
     * @return The named {@link Retry} instance.
     */
    @Bean
    public Retry toolCallRetry(@Value("${secure-api.retry.max-attempts:1}") int maxAttempts) {
        RetryConfig config = RetryConfig.<ResponseEntity<String>>custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnResult(response -> RETRYABLE_STATUSES.contains(response.getStatusCode().value()))
                .retryOnException(e -> false)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        return registry.retry("secure-api-tool-call");
    }
}
