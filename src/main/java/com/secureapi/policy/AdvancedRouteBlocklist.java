package com.secureapi.policy;

/**
 * Recognizes "advanced" vendor operations, which stay hidden unless the blocklist is
 * switched off.
 */
public final class AdvancedRouteBlocklist {

    public static final String ADVANCED_MARKER = "-advanced";

    private AdvancedRouteBlocklist() {
    }

    public static boolean isAdvanced(String path) {
        return path != null && path.contains(ADVANCED_MARKER);
    }
}
