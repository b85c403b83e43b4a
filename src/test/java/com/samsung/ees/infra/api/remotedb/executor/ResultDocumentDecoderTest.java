package com.samsung.ees.infra.api.remotedb.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.ees.infra.api.remotedb.exception.RemoteExecutionException;
import com.samsung.ees.infra.api.remotedb.exception.ResultDecodeException;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultDocumentDecoderTest {
    private final ResultDocumentDecoder decoder = new ResultDocumentDecoder(new ObjectMapper());

    @Test
    void decode_withBlankDocument_shouldReturnEmptyRowSet() {
        assertTrue(decoder.decode("  \n").isEmpty());
        assertTrue(decoder.decode(null).isEmpty());
        assertTrue(decoder.decode("[]").isEmpty());
    }

    @Test
    void decode_shouldKeepExplicitNulls() {
        RowSet rows = decoder.decode("[{\"device_sn\": \"A\", \"activePower\": null}]");

        assertTrue(rows.getRows().get(0).contains("activePower"));
        assertNull(rows.getRows().get(0).get("activePower"));
    }

    @Test
    void decode_withErrorDocument_shouldThrowRemoteExecutionException() {
        RemoteExecutionException ex = assertThrows(RemoteExecutionException.class,
                () -> decoder.decode("{\"error\": \"database is locked\"}"));

        assertEquals("SQL query failed: database is locked", ex.getMessage());
    }

    @Test
    void decode_withUnexpectedShape_shouldThrowResultDecodeException() {
        assertThrows(ResultDecodeException.class, () -> decoder.decode("{\"rows\": []}"));
        assertThrows(ResultDecodeException.class, () -> decoder.decode("[1, 2, 3]"));
        assertThrows(ResultDecodeException.class, () -> decoder.decode("not json"));
    }

    @Test
    void errorMessage_shouldOnlyReadErrorDocuments() {
        assertEquals("disk I/O error", decoder.errorMessage("{\"error\": \"disk I/O error\"}\n"));
        assertNull(decoder.errorMessage("Traceback (most recent call last):"));
        assertNull(decoder.errorMessage(""));
    }
}
