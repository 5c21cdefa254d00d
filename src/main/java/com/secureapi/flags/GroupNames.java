package com.secureapi.flags;

import java.util.Locale;

/**
 * Naming rules shared by the group extractor and the flag loader.
 */
public final class GroupNames {

    private GroupNames() {
    }

    /**
     * Turns an OpenAPI tag into a group name: lower-case, spaces replaced by dashes.
     * "Device Reporting" becomes "device-reporting".
     */
    public static String fromTag(String tag) {
        return tag.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    /**
     * Turns the suffix of a feature environment variable into a group name: lower-case,
     * underscores replaced by dashes. "DEVICE_REPORTING" becomes "device-reporting".
     */
    public static String fromEnvSuffix(String suffix) {
        return suffix.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
