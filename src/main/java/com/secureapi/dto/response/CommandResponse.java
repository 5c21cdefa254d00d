package com.secureapi.dto.response;

/**
 * A record that represents the outcome of a shell command execution.
 *
 * @param success A boolean flag indicating whether the command executed successfully.
 * @param message A descriptive message detailing the result of the command.
 */
public record CommandResponse(boolean success, String message) {

    /**
     * Formats the response message with ANSI color codes: green for success, red for failure.
     *
     * @return A string containing the message wrapped in ANSI color codes.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
