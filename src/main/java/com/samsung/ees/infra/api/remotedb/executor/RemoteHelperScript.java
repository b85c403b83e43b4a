package com.samsung.ees.infra.api.remotedb.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * The fixed query helper program run on the remote host, and the shell command that runs it.
 * <p>
 * The program text never changes per query. Database path and statement travel as Base64
 * arguments; the helper is fed to the interpreter through a quoted heredoc so the remote shell
 * performs no expansion on it.
 */
@Slf4j
@Component
public class RemoteHelperScript {
    static final String RESOURCE = "/remote/query_runner.py";

    private final String source;

    public RemoteHelperScript() {
        this(loadSource());
    }

    RemoteHelperScript(String source) {
        this.source = source;
    }

    private static String loadSource() {
        try (InputStream in = RemoteHelperScript.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Cannot find remote helper program: " + RESOURCE);
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.info("Loaded remote query helper ({} bytes).", text.length());
            return text;
        } catch (IOException e) {
            log.error("Failed to load remote query helper.", e);
            throw new UncheckedIOException("Failed to initialize RemoteHelperScript due to resource loading error.", e);
        }
    }

    public String getSource() {
        return source;
    }

    /**
     * Builds the remote command line for one query.
     *
     * @param interpreter  interpreter name, restricted to plain path characters by configuration
     * @param dbPath       database file on the remote host
     * @param sql          the single statement to run
     * @param scratchPath  generated result file path, plain path characters only
     */
    public String command(String interpreter, String dbPath, String sql, String scratchPath) {
        String marker = "REMOTE_QUERY_EOF_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return interpreter + " - '" + RemoteArguments.encode(dbPath) + "' '" + RemoteArguments.encode(sql) + "' '"
                + scratchPath + "' <<'" + marker + "'\n"
                + source
                + (source.endsWith("\n") ? "" : "\n")
                + marker + "\n";
    }
}
