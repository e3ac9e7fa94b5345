package com.anonymizer.sidecar;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runs one worker command per call: the payload goes to the worker's
 * standard input, the response document comes back from its standard output.
 */
public interface SidecarBridge {

    /**
     * Execute a worker command and wait for its response.
     *
     * @param commandName worker operation, passed as the last positional argument
     * @param payload     request document, any value Jackson can serialize;
     *                    null sends an empty object
     * @param token       cancels the call while it runs
     * @return the parsed response document, never containing an error field
     * @throws SidecarException on any failure, classified by
     *                          {@link SidecarException#getKind()}
     */
    JsonNode execute(String commandName, Object payload, CancellationToken token) throws SidecarException;

    default JsonNode execute(String commandName, Object payload) throws SidecarException {
        return execute(commandName, payload, new CancellationToken());
    }
}
