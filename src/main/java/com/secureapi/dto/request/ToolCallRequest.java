package com.secureapi.dto.request;

/**
 * Raw input of the {@code call} shell command.
 *
 * @param tool      The tool name.
 * @param arguments The arguments as a JSON object literal.
 */
public record ToolCallRequest(String tool, String arguments) {
}
