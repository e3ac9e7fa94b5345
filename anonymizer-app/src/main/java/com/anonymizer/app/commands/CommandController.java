package com.anonymizer.app.commands;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * Loopback HTTP entry point the UI uses to invoke host commands.
 */
@RestController
@RequestMapping("/api/commands")
public class CommandController {

    private final HostCommandDispatcher dispatcher;

    public CommandController(HostCommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping
    public Map<String, Set<String>> list() {
        return Map.of("commands", dispatcher.commandNames());
    }

    @PostMapping("/{name}")
    public ResponseEntity<CommandResult> invoke(@PathVariable("name") String name,
            @RequestBody(required = false) JsonNode args) {
        if (!dispatcher.isKnown(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(CommandResult.error("Unknown command: " + name));
        }
        return ResponseEntity.ok(dispatcher.dispatch(name, args));
    }
}
