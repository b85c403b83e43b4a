package com.samsung.ees.infra.api.remotedb.service;

import com.samsung.ees.infra.api.remotedb.model.WideRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.io.DelegatingPositionOutputStream;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes a wide table as a Parquet file.
 * <p>
 * The Avro schema is derived from the rows: {@code local_timestamp} first, then every other
 * column sorted by name as an optional long, double or string. Column names that are not valid
 * Avro names are rewritten, and the original name is kept as the field's doc.
 */
@Slf4j
@Service
public class WideTableParquetService {
    static final String RECORD_NAME = "WideRow";
    static final String NAMESPACE = "com.samsung.ees.infra.api.remotedb";

    private static final Schema VALUE_SCHEMA = Schema.createUnion(
            Schema.create(Schema.Type.NULL),
            Schema.create(Schema.Type.LONG),
            Schema.create(Schema.Type.DOUBLE),
            Schema.create(Schema.Type.STRING));

    /**
     * Converts the rows into a Parquet file held in memory.
     * All rows are collected first, since the schema depends on the columns of every row.
     *
     * @return the file bytes, or an empty array when there are no rows
     */
    public Mono<byte[]> convertToParquet(Flux<WideRow> wideRows) {
        return wideRows.collectList().flatMap(rows -> {
            if (rows.isEmpty()) {
                log.debug("Input data stream is empty. Returning empty byte array.");
                return Mono.just(new byte[0]);
            }

            log.info("Starting Parquet conversion for {} wide rows.", rows.size());
            return Mono.fromCallable(() -> write(rows))
                    .subscribeOn(Schedulers.boundedElastic())
                    .onErrorMap(e -> new IllegalStateException("Failed to convert wide table to Parquet", e));
        });
    }

    private byte[] write(List<WideRow> rows) {
        Map<String, String> fieldNames = fieldNames(rows);
        Schema schema = buildSchema(fieldNames);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (ParquetWriter<GenericRecord> writer = createParquetWriter(baos, schema)) {
                for (WideRow row : rows) {
                    writer.write(toRecord(row, schema, fieldNames));
                }
            }
            log.info("In-memory Parquet conversion completed: {} columns.", schema.getFields().size());
            return baos.toByteArray();
        } catch (IOException e) {
            log.error("Error during in-memory Parquet conversion", e);
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Maps every wide table column to a unique Avro field name, {@code local_timestamp} first.
     */
    static Map<String, String> fieldNames(List<WideRow> rows) {
        Set<String> columns = new TreeSet<>();
        for (WideRow row : rows) {
            columns.addAll(row.getColumns().keySet());
        }
        columns.remove(WideRow.TIMESTAMP_COLUMN);

        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        names.put(WideRow.TIMESTAMP_COLUMN, WideRow.TIMESTAMP_COLUMN);
        used.add(WideRow.TIMESTAMP_COLUMN);
        for (String column : columns) {
            String base = toAvroName(column);
            String candidate = base;
            int suffix = 2;
            while (!used.add(candidate)) {
                candidate = base + "_" + suffix++;
            }
            names.put(column, candidate);
        }
        return names;
    }

    static String toAvroName(String column) {
        StringBuilder name = new StringBuilder(column.length() + 1);
        for (int i = 0; i < column.length(); i++) {
            char c = column.charAt(i);
            boolean valid = c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            name.append(valid ? c : '_');
        }
        if (name.length() == 0 || Character.isDigit(name.charAt(0))) {
            name.insert(0, '_');
        }
        return name.toString();
    }

    private static Schema buildSchema(Map<String, String> fieldNames) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME).namespace(NAMESPACE).fields();
        fields = fields.name(WideRow.TIMESTAMP_COLUMN).type().longType().noDefault();
        for (Map.Entry<String, String> entry : fieldNames.entrySet()) {
            if (WideRow.TIMESTAMP_COLUMN.equals(entry.getKey())) {
                continue;
            }
            fields = fields.name(entry.getValue()).doc(entry.getKey()).type(VALUE_SCHEMA).withDefault(null);
        }
        return fields.endRecord();
    }

    private static GenericRecord toRecord(WideRow row, Schema schema, Map<String, String> fieldNames) {
        GenericRecord record = new GenericData.Record(schema);
        record.put(WideRow.TIMESTAMP_COLUMN, row.getLocalTimestamp());
        row.getColumns().forEach((column, value) -> {
            String field = fieldNames.get(column);
            if (field != null && !WideRow.TIMESTAMP_COLUMN.equals(field)) {
                record.put(field, toAvroValue(value));
            }
        });
        return record;
    }

    private static Object toAvroValue(Object value) {
        if (value == null || value instanceof Long || value instanceof Double || value instanceof String) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return value.toString();
    }

    private ParquetWriter<GenericRecord> createParquetWriter(ByteArrayOutputStream outputStream, Schema schema) throws IOException {
        Configuration conf = new Configuration();
        conf.set("fs.file.impl.disable.cache", "true");
        return AvroParquetWriter.<GenericRecord>builder(new InMemoryOutputFile(outputStream))
                .withSchema(schema)
                .withConf(conf)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build();
    }

    // Lets ParquetWriter write straight into a byte array.
    private static class InMemoryOutputFile implements OutputFile {
        private final ByteArrayOutputStream baos;

        InMemoryOutputFile(ByteArrayOutputStream baos) {
            this.baos = baos;
        }

        @Override
        public PositionOutputStream create(long blockSizeHint) {
            return new InMemoryPositionOutputStream(baos);
        }

        @Override
        public PositionOutputStream createOrOverwrite(long blockSizeHint) {
            baos.reset();
            return new InMemoryPositionOutputStream(baos);
        }

        @Override
        public boolean supportsBlockSize() {
            return false;
        }

        @Override
        public long defaultBlockSize() {
            return 0;
        }
    }

    private static class InMemoryPositionOutputStream extends DelegatingPositionOutputStream {
        private final ByteArrayOutputStream baos;

        InMemoryPositionOutputStream(ByteArrayOutputStream baos) {
            super(baos);
            this.baos = baos;
        }

        @Override
        public long getPos() {
            return baos.size();
        }
    }
}
