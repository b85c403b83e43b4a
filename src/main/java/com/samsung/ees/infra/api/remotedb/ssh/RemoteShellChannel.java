package com.samsung.ees.infra.api.remotedb.ssh;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A command channel and a file transfer channel to one remote host.
 * <p>
 * Implementations are a single logical session and make no promise about concurrent use;
 * callers serialize access.
 */
public interface RemoteShellChannel {

    /**
     * Runs a command through the remote user's shell and waits for it to finish.
     *
     * @throws IOException if the command could not be started
     */
    CommandResult runCommand(String command) throws IOException;

    /**
     * @return {@code true} when the file was copied completely
     */
    boolean uploadFile(Path localPath, String remotePath);

    /**
     * @return {@code true} when the file was copied completely
     */
    boolean downloadFile(String remotePath, Path localPath);
}
