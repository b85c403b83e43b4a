package com.samsung.ees.infra.api.remotedb.executor;

import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.exception.RemoteExecutionException;
import com.samsung.ees.infra.api.remotedb.exception.ResultTransportException;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.ssh.CommandResult;
import com.samsung.ees.infra.api.remotedb.ssh.RemoteShellChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one read-only SQL statement against a database file on the remote host.
 * <p>
 * The helper writes its result to a uniquely named scratch file, which is copied back over the
 * file transfer channel instead of being read from stdout. Both the remote and the local scratch
 * file are removed after every call, whatever the outcome.
 * <p>
 * Not synchronized: callers sharing one {@link RemoteShellChannel} serialize their calls.
 */
@Slf4j
@Component
public class RemoteQueryExecutor {
    static final int COMMAND_NOT_FOUND_EXIT_CODE = 127;

    private final RemoteShellChannel channel;
    private final RemoteHelperScript helperScript;
    private final ResultDocumentDecoder decoder;
    private final ExecutorService transferExecutor;
    private final RemoteQueryProperties properties;

    public RemoteQueryExecutor(RemoteShellChannel channel,
                               RemoteHelperScript helperScript,
                               ResultDocumentDecoder decoder,
                               ExecutorService transferExecutor,
                               RemoteQueryProperties properties) {
        this.channel = channel;
        this.helperScript = helperScript;
        this.decoder = decoder;
        this.transferExecutor = transferExecutor;
        this.properties = properties;
    }

    /**
     * @throws RemoteExecutionException if the helper could not run or reported a failure
     * @throws ResultTransportException if the result file could not be copied back in time
     * @throws com.samsung.ees.infra.api.remotedb.exception.ResultDecodeException if the result is not a row document
     */
    public RowSet execute(String dbPath, String sql) {
        String scratchPath = newScratchPath();
        Path localCopy = null;
        try {
            CommandResult result = runHelper(properties.getPythonCommand(), dbPath, sql, scratchPath);
            if (!result.isSuccess() && isInterpreterMissing(result, properties.getPythonCommand())) {
                log.info("{} not found, trying {}", properties.getPythonCommand(), properties.getFallbackPythonCommand());
                result = runHelper(properties.getFallbackPythonCommand(), dbPath, sql, scratchPath);
            }
            if (!result.isSuccess()) {
                throw new RemoteExecutionException("SQL query failed: " + describeFailure(result));
            }

            String reportedPath = result.stdoutText().trim();
            if (!scratchPath.equals(reportedPath)) {
                throw new RemoteExecutionException("Remote helper reported an unexpected result path: " + reportedPath);
            }
            log.info("Remote result file: {}", scratchPath);

            localCopy = Files.createTempFile("remote-query-", ".json");
            transfer(scratchPath, localCopy);
            String document = Files.readString(localCopy, StandardCharsets.UTF_8);
            log.info("Result file downloaded: {} characters", document.length());
            return decoder.decode(document);
        } catch (IOException e) {
            throw new ResultTransportException("Unable to read downloaded result file: " + e.getMessage(), e);
        } finally {
            removeRemote(scratchPath);
            removeLocal(localCopy);
        }
    }

    String newScratchPath() {
        String dir = properties.getRemoteScratchDir();
        String prefix = dir.endsWith("/") ? dir : dir + "/";
        return prefix + "query_result_" + UUID.randomUUID().toString().replace("-", "") + ".json";
    }

    private CommandResult runHelper(String interpreter, String dbPath, String sql, String scratchPath) {
        String command = helperScript.command(interpreter, dbPath, sql, scratchPath);
        log.debug("Running remote query helper with {} for {}", interpreter, dbPath);
        try {
            return channel.runCommand(command);
        } catch (IOException | RuntimeException e) {
            throw new RemoteExecutionException("Remote query process could not be started: " + e.getMessage(), e);
        }
    }

    static boolean isInterpreterMissing(CommandResult result, String interpreter) {
        if (result.exitCode() == COMMAND_NOT_FOUND_EXIT_CODE) {
            return true;
        }
        String stderr = result.stderrText().toLowerCase(Locale.ROOT);
        return stderr.contains("command not found")
                || stderr.contains(interpreter.toLowerCase(Locale.ROOT) + ": not found");
    }

    private String describeFailure(CommandResult result) {
        String stderr = result.stderrText().trim();
        String stdout = result.stdoutText().trim();
        String message = decoder.errorMessage(stderr.isEmpty() ? stdout : stderr);
        if (message != null) {
            return message;
        }
        if (!stderr.isEmpty()) {
            return stderr;
        }
        return stdout.isEmpty() ? "Unknown error (exit code " + result.exitCode() + ")" : stdout;
    }

    private void transfer(String scratchPath, Path localCopy) {
        Duration timeout = properties.getTransferTimeout();
        // set once the caller gives up; a worker still copying then removes its own output
        AtomicBoolean abandoned = new AtomicBoolean();
        Future<Boolean> download = transferExecutor.submit(() -> {
            try {
                return channel.downloadFile(scratchPath, localCopy);
            } finally {
                if (abandoned.get()) {
                    removeLocal(localCopy);
                }
            }
        });
        boolean copied;
        try {
            copied = download.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandoned.set(true);
            download.cancel(true);
            throw new ResultTransportException("Download of " + scratchPath + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            abandoned.set(true);
            download.cancel(true);
            Thread.currentThread().interrupt();
            throw new ResultTransportException("Interrupted while downloading " + scratchPath, e);
        } catch (ExecutionException e) {
            log.error("Download of {} failed", scratchPath, e.getCause());
            throw new ResultTransportException("Unable to download result file: " + e.getCause().getMessage(), e.getCause());
        }
        if (!copied) {
            throw new ResultTransportException("Unable to download result file: " + scratchPath);
        }
    }

    private void removeRemote(String scratchPath) {
        try {
            CommandResult result = channel.runCommand("rm -f '" + scratchPath + "'");
            if (result.isSuccess()) {
                log.debug("Remote scratch file removed: {}", scratchPath);
            } else {
                log.warn("Failed to remove remote scratch file {}: {}", scratchPath, result.stderrText().trim());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Error while removing remote scratch file {}", scratchPath, e);
        }
    }

    private static void removeLocal(Path localCopy) {
        if (localCopy == null) {
            return;
        }
        try {
            Files.deleteIfExists(localCopy);
        } catch (IOException e) {
            log.warn("Failed to delete local scratch file: {}", localCopy, e);
        }
    }
}
