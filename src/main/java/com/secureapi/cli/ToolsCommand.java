package com.secureapi.cli;

import com.secureapi.dto.response.CommandResponse;
import com.secureapi.flags.FeatureFlagRegistry;
import com.secureapi.model.ApiOperation;
import com.secureapi.model.RouteKind;
import com.secureapi.model.ToolDefinition;
import com.secureapi.service.api.ToolCatalogService;
import java.util.Collection;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for inspecting what is exposed: the tool list, the feature group state, and
 * the admission decision for an arbitrary route.
 */
@ShellComponent
public class ToolsCommand {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final ToolCatalogService toolCatalogService;
    private final FeatureFlagRegistry featureFlagRegistry;

    public ToolsCommand(ToolCatalogService toolCatalogService, FeatureFlagRegistry featureFlagRegistry) {
        this.toolCatalogService = toolCatalogService;
        this.featureFlagRegistry = featureFlagRegistry;
    }

    @ShellMethod(key = "tools", value = "Lists the operations exposed as tools.")
    public String tools() {
        if (!toolCatalogService.isInitialized()) {
            return new CommandResponse(false, "The tool catalog has not been loaded.").toAnsiString();
        }
        Collection<ToolDefinition> tools = toolCatalogService.tools();
        if (tools.isEmpty()) {
            return new CommandResponse(false, "No operations are exposed. Check the ABS_FEATURE_* flags.").toAnsiString();
        }
        StringBuilder out = new StringBuilder();
        for (ToolDefinition tool : tools) {
            ApiOperation op = tool.operation();
            out.append(ANSI_CYAN).append(tool.name()).append(ANSI_RESET)
                    .append("  ").append(op.getHttpMethod()).append(' ').append(op.getPath());
            if (tool.kind() != RouteKind.TOOL) {
                out.append("  [").append(tool.kind()).append(']');
            }
            if (op.getDescription() != null && !op.getDescription().isBlank()) {
                out.append(System.lineSeparator()).append("    ").append(op.getDescription());
            }
            out.append(System.lineSeparator());
        }
        out.append(new CommandResponse(true, tools.size() + " tools exposed.").toAnsiString());
        return out.toString();
    }

    @ShellMethod(key = "groups", value = "Shows feature groups and their flag state.")
    public String groups() {
        StringBuilder out = new StringBuilder();
        out.append("Enabled flags:  ").append(featureFlagRegistry.enabledGroups()).append(System.lineSeparator());
        out.append("Disabled flags: ").append(featureFlagRegistry.disabledGroups()).append(System.lineSeparator());
        for (String group : featureFlagRegistry.groupNames()) {
            boolean enabled = featureFlagRegistry.enabledGroups().contains(group);
            out.append(enabled ? "  + " : "  - ")
                    .append(group)
                    .append(" (").append(featureFlagRegistry.members(group).size()).append(" operations)")
                    .append(System.lineSeparator());
        }
        return out.toString();
    }

    @ShellMethod(key = "route", value = "Explains whether a route is exposed.")
    public String route(
            @ShellOption(value = {"--path", "-p"}, help = "The path as declared in the OpenAPI document.") String path,
            @ShellOption(value = {"--method", "-m"}, help = "The HTTP method.", defaultValue = "GET") String method
    ) {
        RouteKind kind = toolCatalogService.explain(path, method);
        String groups = featureFlagRegistry.groupNames().stream()
                .filter(g -> featureFlagRegistry.members(g).stream()
                        .anyMatch(k -> k.path().equals(path) && k.method().equalsIgnoreCase(method)))
                .collect(Collectors.joining(", "));
        String detail = method.toUpperCase() + " " + path + " -> " + kind
                + (groups.isEmpty() ? " (no feature group)" : " (groups: " + groups + ")");
        return kind == RouteKind.EXCLUDED
                ? ANSI_YELLOW + detail + ANSI_RESET
                : new CommandResponse(true, detail).toAnsiString();
    }
}
