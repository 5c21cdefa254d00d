package com.secureapi.policy;

import com.secureapi.flags.FeatureFlagRegistry;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.RouteKind;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, per operation, whether it is exposed and as what.
 * <p>
 * Rules, in priority order:
 * <ol>
 *   <li>an advanced path is {@link RouteKind#EXCLUDED} while the blocklist is active, without
 *       consulting the flags;</li>
 *   <li>an operation whose feature group is disabled is {@link RouteKind#EXCLUDED};</li>
 *   <li>GET, POST, PUT, PATCH and DELETE are {@link RouteKind#TOOL};</li>
 *   <li>any other method keeps the caller's default classification.</li>
 * </ol>
 * Decisions are stateless and may be requested concurrently.
 */
@Slf4j
public class RoutePolicyEngine {

    static final Set<String> TOOL_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final FeatureFlagRegistry registry;
    private final boolean advancedBlocklistEnabled;

    public RoutePolicyEngine(FeatureFlagRegistry registry, boolean advancedBlocklistEnabled) {
        this.registry = registry;
        this.advancedBlocklistEnabled = advancedBlocklistEnabled;
    }

    public RouteKind decide(String path, String method, RouteKind defaultKind) {
        if (advancedBlocklistEnabled && AdvancedRouteBlocklist.isAdvanced(path)) {
            log.debug("Excluding advanced route {} {}", method, path);
            return RouteKind.EXCLUDED;
        }

        String upperMethod = method.toUpperCase(Locale.ROOT);
        if (!registry.isEnabled(path, upperMethod)) {
            log.debug("Excluding feature-disabled route {} {}", upperMethod, path);
            return RouteKind.EXCLUDED;
        }

        if (TOOL_METHODS.contains(upperMethod)) {
            return RouteKind.TOOL;
        }
        return defaultKind;
    }

    public RouteKind decide(ApiOperation operation, RouteKind defaultKind) {
        return decide(operation.getPath(), operation.getHttpMethod(), defaultKind);
    }

    public boolean isAdvancedBlocklistEnabled() {
        return advancedBlocklistEnabled;
    }
}
