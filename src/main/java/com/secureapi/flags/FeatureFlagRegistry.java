package com.secureapi.flags;

import com.secureapi.model.RouteKey;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The single source of truth for "is group X enabled" and "does (path, method) belong to group X".
 * <p>
 * Flags are fixed at construction. Group membership is filled once at startup by the
 * {@link GroupExtractor} and only read afterwards, so lookups need no locking.
 * <p>
 * Evaluation rules:
 * <ul>
 *   <li>an operation in no group is enabled;</li>
 *   <li>an operation in a group takes that group's flag, {@code false} when the flag is unset;</li>
 *   <li>an operation in several groups takes the flag of the lexicographically first one.</li>
 * </ul>
 */
public class FeatureFlagRegistry {

    private final Map<String, Boolean> flags;
    private final Map<String, Set<RouteKey>> groups = new TreeMap<>();

    public FeatureFlagRegistry(Map<String, Boolean> flags) {
        this.flags = Map.copyOf(flags);
    }

    /**
     * Adds (path, method) to the named group, creating the group if needed. Registering the
     * same pair twice has no effect.
     */
    public void registerMember(String groupName, String path, String method) {
        groups.computeIfAbsent(groupName, name -> new LinkedHashSet<>()).add(new RouteKey(path, method));
    }

    public boolean isEnabled(String path, String method) {
        if (groups.isEmpty()) {
            return true;
        }
        RouteKey key = new RouteKey(path, method);
        for (Map.Entry<String, Set<RouteKey>> group : groups.entrySet()) {
            if (group.getValue().contains(key)) {
                return flags.getOrDefault(group.getKey(), false);
            }
        }
        return true;
    }

    public SortedSet<String> enabledGroups() {
        return flagNames(true);
    }

    public SortedSet<String> disabledGroups() {
        return flagNames(false);
    }

    public Set<String> groupNames() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    public Set<RouteKey> members(String groupName) {
        return Collections.unmodifiableSet(groups.getOrDefault(groupName, Set.of()));
    }

    private SortedSet<String> flagNames(boolean enabled) {
        return flags.entrySet().stream()
                .filter(e -> e.getValue() == enabled)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
