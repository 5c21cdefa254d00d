package com.secureapi.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.secureapi.dto.request.ToolCallRequest;
import com.secureapi.dto.response.CommandResponse;
import com.secureapi.service.api.ToolInvocationService;
import java.util.Map;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for calling an exposed tool by name. Arguments are given as one JSON
 * object; the response status and body are printed as received from the validation endpoint.
 */
@ShellComponent
public class CallCommand {

    private final ToolInvocationService toolInvocationService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public CallCommand(ToolInvocationService toolInvocationService) {
        this.toolInvocationService = toolInvocationService;
    }

    /**
     * Calls a tool and prints the raw result.
     *
     * @param tool      The tool name, as listed by the {@code tools} command.
     * @param arguments Tool arguments as a JSON object, e.g. {@code {"pageSize": 10}}.
     * @param verbose   If true, enables debug logging (including the produced JWS) for the
     *                  duration of the call.
     * @return The response status and body, or an error message.
     */
    @ShellMethod(key = "call", value = "Calls an exposed tool.")
    public String call(
            @ShellOption(value = {"--tool", "-t"}, help = "The tool name.") String tool,
            @ShellOption(value = {"--args", "-a"}, help = "Tool arguments as a JSON object.", defaultValue = "{}") String arguments,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        var request = new ToolCallRequest(tool, arguments);
        try {
            Map<String, Object> args = objectMapper.readValue(request.arguments(), new TypeReference<>() {});
            ResponseEntity<String> response = toolInvocationService.invoke(request.tool(), args).block();
            if (response == null) {
                return new CommandResponse(false, "No response received for tool '" + request.tool() + "'.").toAnsiString();
            }
            boolean success = response.getStatusCode().is2xxSuccessful();
            return new CommandResponse(success, "HTTP " + response.getStatusCode().value()).toAnsiString()
                    + System.lineSeparator() + render(response.getBody());
        } catch (Exception e) {
            return new CommandResponse(false, "Call failed: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }

    private String render(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            return jsonMapper.writeValueAsString(json);
        } catch (Exception e) {
            return body;
        }
    }
}
