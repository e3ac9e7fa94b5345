package com.anonymizer.app.router;

import java.util.List;

/**
 * Typed arguments of a worker command.
 */
public interface WorkerRequest {

    /**
     * Shape problems that make the request unsendable; empty when well-formed.
     */
    List<String> validate();
}
