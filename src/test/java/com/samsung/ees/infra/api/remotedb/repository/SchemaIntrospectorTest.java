package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.exception.RemoteExecutionException;
import com.samsung.ees.infra.api.remotedb.executor.RemoteQueryExecutor;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaIntrospectorTest {
    private static final String DB_PATH = "/data/ems/device.db";

    @Mock
    private RemoteQueryExecutor executor;

    @InjectMocks
    private SchemaIntrospector schemaIntrospector;

    @Test
    void columns_shouldReturnNamesInTableOrder() {
        when(executor.execute(DB_PATH, "PRAGMA table_info(device_data)")).thenReturn(new RowSet(List.of(
                Row.of("cid", 0L, "name", "id", "type", "INTEGER"),
                Row.of("cid", 1L, "name", "device_sn", "type", "TEXT"),
                Row.of("cid", 2L, "name", "activePower", "type", "REAL"))));

        assertEquals(List.of("id", "device_sn", "activePower"), schemaIntrospector.columns(DB_PATH, "device_data"));
    }

    @Test
    void columns_whenRemoteQueryFails_shouldReturnEmptyList() {
        when(executor.execute(anyString(), anyString()))
                .thenThrow(new RemoteExecutionException("SQL query failed: database is locked"));

        assertTrue(schemaIntrospector.columns(DB_PATH, "device_data").isEmpty());
    }

    @Test
    void columns_forUnknownTable_shouldReturnEmptyList() {
        when(executor.execute(DB_PATH, "PRAGMA table_info(missing_table)")).thenReturn(RowSet.empty());

        assertTrue(schemaIntrospector.columns(DB_PATH, "missing_table").isEmpty());
    }

    @Test
    void columns_withUnsafeTableName_shouldRejectBeforeQuerying() {
        assertThrows(IllegalArgumentException.class,
                () -> schemaIntrospector.columns(DB_PATH, "device_data); DROP TABLE cmd_data; --"));
        verifyNoInteractions(executor);
    }
}
