package com.samsung.ees.infra.api.remotedb.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.exception.RemoteExecutionException;
import com.samsung.ees.infra.api.remotedb.exception.ResultDecodeException;
import com.samsung.ees.infra.api.remotedb.exception.ResultTransportException;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.ssh.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteQueryExecutorTest {
    private static final String DB_PATH = "/data/ems/device.db";
    private static final String ROWS = """
            [
              {"id": 1, "device_sn": "PCS001", "timestamp": 1700000000, "activePower": 12.5, "status": null},
              {"id": "2", "device_sn": "PCS002", "timestamp": "1700000001", "activePower": "7.25", "status": "OK"}
            ]
            """;

    private FakeShellChannel channel;
    private ExecutorService transferExecutor;
    private RemoteQueryProperties properties;
    private RemoteQueryExecutor executor;

    @BeforeEach
    void setUp() {
        channel = new FakeShellChannel();
        transferExecutor = Executors.newSingleThreadExecutor();
        properties = new RemoteQueryProperties();
        properties.setTransferTimeout(Duration.ofSeconds(5));
        executor = new RemoteQueryExecutor(channel, new RemoteHelperScript(),
                new ResultDocumentDecoder(new ObjectMapper()), transferExecutor, properties);
    }

    @AfterEach
    void tearDown() {
        transferExecutor.shutdownNow();
    }

    @Test
    void execute_shouldReturnNormalizedRows() {
        channel.respondWith((dbPath, sql) -> ROWS);

        RowSet result = executor.execute(DB_PATH, "SELECT * FROM device_data");

        assertEquals(2, result.getTotalRows());
        assertEquals(List.of("id", "device_sn", "timestamp", "activePower", "status"), result.getColumns());
        Row first = result.getRows().get(0);
        assertEquals(1L, first.get("id"));
        assertEquals(12.5, first.get("activePower"));
        assertTrue(first.contains("status"));
        assertNull(first.get("status"));
        Row second = result.getRows().get(1);
        assertEquals(2L, second.get("id"));
        assertEquals(1700000001L, second.get("timestamp"));
        assertEquals(7.25, second.get("activePower"));
        assertEquals("OK", second.get("status"));
    }

    @Test
    void execute_shouldPassStatementAndPathUnchangedToRemoteHost() {
        String sql = "SELECT name FROM device_data WHERE device_sn = 'O''Brien; rm -rf /' AND note = \"$HOME `id`\"";
        channel.respondWith((dbPath, statement) -> {
            assertEquals("/data/my db/device's.db", dbPath);
            return "[]";
        });

        executor.execute("/data/my db/device's.db", sql);

        assertEquals(List.of(sql), channel.getStatements());
        String command = channel.getCommands().get(0);
        assertFalse(command.contains("rm -rf"), "statement text must not appear in the shell command");
        assertFalse(command.contains("$HOME"));
    }

    @Test
    void execute_shouldUseUniqueScratchFileUnderConfiguredDirectory() {
        properties.setRemoteScratchDir("/var/tmp/queries");

        executor.execute(DB_PATH, "SELECT 1");
        executor.execute(DB_PATH, "SELECT 1");

        List<String> removed = channel.getRemovedPaths();
        assertEquals(2, removed.size());
        assertNotEquals(removed.get(0), removed.get(1));
        assertTrue(removed.get(0).matches("/var/tmp/queries/query_result_[0-9a-f]{32}\\.json"), removed.get(0));
    }

    @Test
    void execute_whenPrimaryInterpreterMissing_shouldRetryWithFallback() {
        channel.withMissingInterpreter("python3").respondWith((dbPath, sql) -> "[{\"v\": 1}]");

        RowSet result = executor.execute(DB_PATH, "SELECT 1 AS v");

        assertEquals(List.of("python"), channel.getInterpretersUsed());
        assertEquals(1L, result.getRows().get(0).get("v"));
    }

    @Test
    void execute_whenNoInterpreterAvailable_shouldThrowRemoteExecutionException() {
        channel.withMissingInterpreter("python3").withMissingInterpreter("python");

        RemoteExecutionException ex = assertThrows(RemoteExecutionException.class,
                () -> executor.execute(DB_PATH, "SELECT 1"));

        assertTrue(ex.getMessage().contains("command not found"), ex.getMessage());
        assertTrue(channel.getRemoteFiles().isEmpty());
    }

    @Test
    void execute_whenRemoteQueryFails_shouldReportRemoteErrorMessage() {
        channel.respondWith((dbPath, sql) -> {
            throw new IllegalStateException("no such table: device_data");
        });

        RemoteExecutionException ex = assertThrows(RemoteExecutionException.class,
                () -> executor.execute(DB_PATH, "SELECT * FROM device_data"));

        assertEquals("SQL query failed: no such table: device_data", ex.getMessage());
        assertEquals(1, channel.getRemovedPaths().size());
    }

    @Test
    void execute_whenDownloadFails_shouldThrowTransportExceptionAndCleanUp() {
        channel.respondWith((dbPath, sql) -> ROWS).failingDownloads();

        assertThrows(ResultTransportException.class, () -> executor.execute(DB_PATH, "SELECT 1"));

        assertTrue(channel.getRemoteFiles().isEmpty());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_whenDownloadTimesOut_shouldThrowTransportExceptionAndCleanUp() {
        properties.setTransferTimeout(Duration.ofMillis(200));
        channel.respondWith((dbPath, sql) -> ROWS).withDownloadDelay(Duration.ofSeconds(5));

        ResultTransportException ex = assertThrows(ResultTransportException.class,
                () -> executor.execute(DB_PATH, "SELECT 1"));

        assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
        assertTrue(channel.getRemoteFiles().isEmpty());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_whenTimedOutDownloadKeepsWriting_shouldStillRemoveLocalCopy() throws InterruptedException {
        properties.setTransferTimeout(Duration.ofMillis(100));
        channel.respondWith((dbPath, sql) -> ROWS).withDownloadDelay(Duration.ofMillis(600)).ignoringInterrupts();

        assertThrows(ResultTransportException.class, () -> executor.execute(DB_PATH, "SELECT 1"));

        transferExecutor.shutdown();
        assertTrue(transferExecutor.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(1, channel.getDownloadTargets().size());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_afterSuccess_shouldLeaveNoScratchFiles() {
        channel.respondWith((dbPath, sql) -> ROWS);

        executor.execute(DB_PATH, "SELECT 1");

        assertTrue(channel.getRemoteFiles().isEmpty());
        assertEquals(1, channel.getDownloadTargets().size());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_whenCleanupFails_shouldStillReturnRows() {
        channel.respondWith((dbPath, sql) -> ROWS).failingCleanup();

        RowSet result = executor.execute(DB_PATH, "SELECT 1");

        assertEquals(2, result.getTotalRows());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_withEmptyDocument_shouldReturnEmptyRowSet() {
        channel.respondWith((dbPath, sql) -> "");

        RowSet result = executor.execute(DB_PATH, "SELECT 1");

        assertTrue(result.isEmpty());
    }

    @Test
    void execute_withMalformedDocument_shouldThrowDecodeExceptionAndCleanUp() {
        channel.respondWith((dbPath, sql) -> "[{\"id\": 1,");

        assertThrows(ResultDecodeException.class, () -> executor.execute(DB_PATH, "SELECT 1"));

        assertTrue(channel.getRemoteFiles().isEmpty());
        assertNoLocalScratchFilesLeft();
    }

    @Test
    void execute_twiceOnUnchangedDatabase_shouldReturnEqualRowSets() {
        channel.respondWith((dbPath, sql) -> ROWS);

        RowSet first = executor.execute(DB_PATH, "SELECT * FROM device_data ORDER BY timestamp");
        RowSet second = executor.execute(DB_PATH, "SELECT * FROM device_data ORDER BY timestamp");

        assertEquals(first, second);
    }

    @Test
    void isInterpreterMissing_shouldRecognizeShellMessages() {
        assertTrue(RemoteQueryExecutor.isInterpreterMissing(
                CommandResult.of(2, "", "sh: 1: python3: not found"), "python3"));
        assertFalse(RemoteQueryExecutor.isInterpreterMissing(
                CommandResult.of(1, "", "{\"error\": \"no such table\"}"), "python3"));
    }

    private void assertNoLocalScratchFilesLeft() {
        for (Path target : channel.getDownloadTargets()) {
            assertFalse(Files.exists(target), "local scratch file left behind: " + target);
        }
    }
}
