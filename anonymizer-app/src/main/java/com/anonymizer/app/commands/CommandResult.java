package com.anonymizer.app.commands;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the host receives for one command: either data or a single error
 * message, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(boolean ok, Object data, String error) {

    public static CommandResult ok(Object data) {
        return new CommandResult(true, data, null);
    }

    public static CommandResult error(String message) {
        return new CommandResult(false, null, message);
    }
}
