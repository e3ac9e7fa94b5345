package com.anonymizer.sidecar;

import java.nio.charset.StandardCharsets;

/**
 * What one worker process left behind: exit status and everything it wrote.
 * Consumed right after the process exits and never kept.
 */
public record ProcessOutcome(int exitCode, byte[] stdout, byte[] stderr) {

    public ProcessOutcome {
        stdout = stdout == null ? new byte[0] : stdout;
        stderr = stderr == null ? new byte[0] : stderr;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String stderrText() {
        return new String(stderr, StandardCharsets.UTF_8);
    }
}
