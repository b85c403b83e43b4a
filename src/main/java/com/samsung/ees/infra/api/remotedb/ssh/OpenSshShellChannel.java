package com.samsung.ees.infra.api.remotedb.ssh;

import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteShellChannel} backed by the local OpenSSH {@code ssh} and {@code scp} clients.
 * <p>
 * Runs in batch mode, so authentication must come from a key file or an agent. Process output
 * is redirected to temporary files to avoid pipe buffers filling up on large outputs.
 */
@Slf4j
public class OpenSshShellChannel implements RemoteShellChannel {
    static final int TIMEOUT_EXIT_CODE = -1;

    private final RemoteQueryProperties.Ssh ssh;
    private final Duration commandTimeout;

    public OpenSshShellChannel(RemoteQueryProperties.Ssh ssh, Duration commandTimeout) {
        this.ssh = ssh;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public CommandResult runCommand(String command) throws IOException {
        List<String> argv = new ArrayList<>();
        argv.add(ssh.getSshExecutable());
        argv.add("-n");
        argv.add("-p");
        argv.add(String.valueOf(ssh.getPort()));
        addCommonOptions(argv);
        argv.add(target());
        argv.add(command);
        return run(argv);
    }

    @Override
    public boolean uploadFile(Path localPath, String remotePath) {
        List<String> argv = scpCommand();
        argv.add(localPath.toString());
        argv.add(target() + ":" + remotePath);
        return copy(argv, localPath + " -> " + remotePath);
    }

    @Override
    public boolean downloadFile(String remotePath, Path localPath) {
        List<String> argv = scpCommand();
        argv.add(target() + ":" + remotePath);
        argv.add(localPath.toString());
        return copy(argv, remotePath + " -> " + localPath);
    }

    List<String> scpCommand() {
        List<String> argv = new ArrayList<>();
        argv.add(ssh.getScpExecutable());
        argv.add("-q");
        argv.add("-P");
        argv.add(String.valueOf(ssh.getPort()));
        addCommonOptions(argv);
        return argv;
    }

    String target() {
        String user = ssh.getUser();
        return user == null || user.isBlank() ? ssh.getHost() : user + "@" + ssh.getHost();
    }

    private void addCommonOptions(List<String> argv) {
        argv.add("-o");
        argv.add("BatchMode=yes");
        argv.add("-o");
        argv.add("ConnectTimeout=" + Math.max(1, ssh.getConnectTimeout().toSeconds()));
        if (ssh.getIdentityFile() != null && !ssh.getIdentityFile().isBlank()) {
            argv.add("-i");
            argv.add(ssh.getIdentityFile());
        }
    }

    private boolean copy(List<String> argv, String description) {
        try {
            CommandResult result = run(argv);
            if (result.isSuccess()) {
                log.debug("Copied {}", description);
                return true;
            }
            log.error("Copy {} failed with exit code {}: {}", description, result.exitCode(), result.stderrText().trim());
            return false;
        } catch (IOException e) {
            log.error("Copy {} could not be started", description, e);
            return false;
        }
    }

    private CommandResult run(List<String> argv) throws IOException {
        Path out = Files.createTempFile("ssh-out-", ".log");
        Path err = Files.createTempFile("ssh-err-", ".log");
        try {
            Process process = new ProcessBuilder(argv)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            boolean finished;
            try {
                finished = process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new IOException("Interrupted while waiting for " + argv.get(0), e);
            }
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} did not finish within {}", argv.get(0), commandTimeout);
                return new CommandResult(TIMEOUT_EXIT_CODE, Files.readAllBytes(out),
                        ("Timed out after " + commandTimeout).getBytes(StandardCharsets.UTF_8));
            }
            return new CommandResult(process.exitValue(), Files.readAllBytes(out), Files.readAllBytes(err));
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file: {}", file, e);
        }
    }
}
