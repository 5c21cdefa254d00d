package com.secureapi.flags;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads feature flags from environment variables.
 * <p>
 * {@code ABS_FEATURE_DEVICE_REPORTING=enabled} yields {@code device-reporting -> true}; any
 * value other than {@code enabled} (case-insensitive) yields {@code false}. When no variable
 * carries the prefix at all, only the default group is switched on.
 */
@Slf4j
public final class FeatureFlagLoader {

    public static final String DEFAULT_PREFIX = "ABS_FEATURE_";
    public static final String DEFAULT_GROUP = "device-reporting";

    private static final String ENABLED = "enabled";

    private FeatureFlagLoader() {
    }

    /**
     * @param environment  The variables to scan, usually {@link System#getenv()}.
     * @param prefix       The variable name prefix.
     * @param defaultGroup The group enabled when no flag variable is present; blank for none.
     * @return An immutable, name-ordered flag map.
     */
    public static Map<String, Boolean> fromEnvironment(Map<String, String> environment, String prefix, String defaultGroup) {
        Map<String, Boolean> flags = new TreeMap<>();
        environment.forEach((key, value) -> {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                flags.put(GroupNames.fromEnvSuffix(key.substring(prefix.length())),
                        value != null && ENABLED.equals(value.trim().toLowerCase(Locale.ROOT)));
            }
        });

        if (flags.isEmpty() && defaultGroup != null && !defaultGroup.isBlank()) {
            log.info("No {}* variables set, enabling only the '{}' group", prefix, defaultGroup);
            flags.put(defaultGroup, true);
        }
        return Collections.unmodifiableMap(flags);
    }
}
