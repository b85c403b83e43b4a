package com.samsung.ees.infra.api.remotedb.ssh;

import java.nio.charset.StandardCharsets;

/**
 * Outcome of one remote command.
 */
public record CommandResult(int exitCode, byte[] stdout, byte[] stderr) {

    public static CommandResult of(int exitCode, String stdout, String stderr) {
        return new CommandResult(exitCode, stdout.getBytes(StandardCharsets.UTF_8), stderr.getBytes(StandardCharsets.UTF_8));
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
