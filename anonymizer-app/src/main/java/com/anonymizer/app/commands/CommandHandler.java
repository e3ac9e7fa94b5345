package com.anonymizer.app.commands;

import com.anonymizer.app.router.CommandException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles one host command.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * @param args host arguments as sent by the UI, an empty object when none
     * @return the result to hand back to the host
     * @throws CommandException         when the worker call fails
     * @throws IllegalArgumentException when the host arguments are malformed
     */
    CommandResult handle(JsonNode args) throws CommandException;
}
