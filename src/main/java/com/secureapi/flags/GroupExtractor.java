package com.secureapi.flags;

import com.secureapi.model.ApiOperation;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives feature groups from operation tags and registers every tagged operation in the
 * {@link FeatureFlagRegistry}. Untagged operations join no group and stay enabled.
 * <p>
 * The pass runs once, after the whole document is loaded and before the first admission
 * decision.
 */
@Slf4j
public class GroupExtractor {

    private final FeatureFlagRegistry registry;
    private final AtomicBoolean extracted = new AtomicBoolean();

    public GroupExtractor(FeatureFlagRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param operations Every operation of the loaded document.
     * @return The number of (group, operation) registrations made.
     * @throws IllegalStateException if groups were already extracted.
     */
    public int extract(Collection<ApiOperation> operations) {
        if (!extracted.compareAndSet(false, true)) {
            throw new IllegalStateException("Feature groups have already been extracted");
        }
        int registrations = 0;
        for (ApiOperation operation : operations) {
            if (operation.getTags() == null) {
                continue;
            }
            for (String tag : operation.getTags()) {
                String group = GroupNames.fromTag(tag);
                registry.registerMember(group, operation.getPath(), operation.getHttpMethod());
                registrations++;
                log.info("Registered route: {} {} to API group: {}", operation.getHttpMethod(), operation.getPath(), group);
            }
        }
        log.info("API groups registered with feature flag registry: {}", registry.groupNames());
        return registrations;
    }
}
