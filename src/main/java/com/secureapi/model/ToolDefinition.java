package com.secureapi.model;

/**
 * An operation that survived the route policy and is callable as a tool.
 *
 * @param name      The tool name (the operation id).
 * @param kind      The admission decision, never {@link RouteKind#EXCLUDED}.
 * @param operation The operation the tool calls.
 */
public record ToolDefinition(String name, RouteKind kind, ApiOperation operation) {
}
