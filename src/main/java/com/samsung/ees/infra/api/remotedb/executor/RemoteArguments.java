package com.samsung.ees.infra.api.remotedb.executor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Transport encoding for values passed to the remote helper. Base64 text needs no shell quoting.
 */
public final class RemoteArguments {

    private RemoteArguments() {
        // Private constructor to prevent instantiation
    }

    public static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Inverse of {@link #encode(String)}, the same decoding the remote helper applies.
     */
    public static String decode(String encoded) {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
