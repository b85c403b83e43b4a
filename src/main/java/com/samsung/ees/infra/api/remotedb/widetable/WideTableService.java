package com.samsung.ees.infra.api.remotedb.widetable;

import com.samsung.ees.infra.api.remotedb.config.ExtractionConfig;
import com.samsung.ees.infra.api.remotedb.config.ExtractionConfigLoader;
import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.model.WideRow;
import com.samsung.ees.infra.api.remotedb.repository.CommandDataRepository;
import com.samsung.ees.infra.api.remotedb.repository.DeviceDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the wide table: one row per {@code local_timestamp} holding every device measurement,
 * payload field and command reported at that millisecond, each column prefixed with the
 * reporting device's serial number.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WideTableService {
    static final String DEVICE_SN = "device_sn";
    static final String DEVICE_TYPE = "device_type";
    static final String COMMAND_NAME = "name";
    static final String COMMAND_VALUE = "value";

    private final DeviceDataRepository deviceDataRepository;
    private final CommandDataRepository commandDataRepository;
    private final PayloadFieldExtractor payloadFieldExtractor;
    private final ExtractionConfigLoader extractionConfigLoader;
    private final RemoteQueryProperties properties;

    public List<WideRow> buildWideTable(String dbPath, long startTime, long endTime, boolean includeExt) {
        return buildWideTable(dbPath, startTime, endTime, includeExt, ProgressListener.NONE);
    }

    /**
     * Fetches device and command rows for the whole range, across all devices, and merges them.
     *
     * @param startTime inclusive, epoch seconds
     * @param endTime   inclusive, epoch seconds
     * @param listener  progress observer, may be {@code null}
     * @return rows ascending by {@code local_timestamp}
     */
    public List<WideRow> buildWideTable(String dbPath, long startTime, long endTime, boolean includeExt,
                                        ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        RowSet deviceRows;
        RowSet commandRows;
        if (properties.isParallelFetch()) {
            progress.onProgress(WideTableStage.FETCHING_PRIMARY, 0);
            progress.onProgress(WideTableStage.FETCHING_SECONDARY, 40);
            Tuple2<RowSet, RowSet> fetched = Mono.zip(
                            Mono.fromCallable(() -> deviceDataRepository.findByTimeRange(dbPath, startTime, endTime, null, includeExt))
                                    .subscribeOn(Schedulers.boundedElastic()),
                            Mono.fromCallable(() -> commandDataRepository.findByTimeRange(dbPath, startTime, endTime, null))
                                    .subscribeOn(Schedulers.boundedElastic()))
                    .block();
            deviceRows = fetched.getT1();
            commandRows = fetched.getT2();
        } else {
            progress.onProgress(WideTableStage.FETCHING_PRIMARY, 0);
            deviceRows = deviceDataRepository.findByTimeRange(dbPath, startTime, endTime, null, includeExt);
            progress.onProgress(WideTableStage.FETCHING_SECONDARY, 40);
            commandRows = commandDataRepository.findByTimeRange(dbPath, startTime, endTime, null);
        }

        List<WideRow> wideTable = merge(deviceRows, commandRows, includeExt, extractionConfigLoader.getConfig(), progress);
        log.info("Wide table built: {} rows from {} device rows and {} command rows",
                wideTable.size(), deviceRows.getTotalRows(), commandRows.getTotalRows());
        return wideTable;
    }

    /**
     * Merges already fetched rows. Runs on the calling thread.
     *
     * @param listener progress observer, may be {@code null}
     */
    public List<WideRow> merge(RowSet deviceRows, RowSet commandRows, boolean includeExt,
                               ExtractionConfig config, ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        int stride = properties.getProgressStride();
        progress.onProgress(WideTableStage.MERGING, 60);

        Map<Long, Map<String, Object>> accumulator = new HashMap<>();
        List<String> measurementFields = config.carriedMeasurementFields();

        List<Row> devices = deviceRows.getRows();
        for (int i = 0; i < devices.size(); i++) {
            if (i % stride == 0) {
                progress.onProgress(WideTableStage.MERGING, 60 + 20.0 * i / devices.size());
            }
            mergeDeviceRow(devices.get(i), includeExt, config, measurementFields, accumulator);
        }

        List<Row> commands = commandRows.getRows();
        for (int i = 0; i < commands.size(); i++) {
            if (i % stride == 0) {
                progress.onProgress(WideTableStage.MERGING, 80 + 15.0 * i / commands.size());
            }
            mergeCommandRow(commands.get(i), accumulator);
        }

        progress.onProgress(WideTableStage.MERGING, 95);
        List<Long> timestamps = new ArrayList<>(accumulator.keySet());
        timestamps.sort(null);
        List<WideRow> result = new ArrayList<>(timestamps.size());
        for (Long timestamp : timestamps) {
            result.add(new WideRow(timestamp, accumulator.get(timestamp)));
        }
        progress.onProgress(WideTableStage.FINALIZING, 100);
        return result;
    }

    private void mergeDeviceRow(Row row, boolean includeExt, ExtractionConfig config,
                                List<String> measurementFields, Map<Long, Map<String, Object>> accumulator) {
        Long timestamp = row.getLong(WideRow.TIMESTAMP_COLUMN);
        if (timestamp == null) {
            return;
        }
        // the timestamp is registered even if the row contributes no columns
        Map<String, Object> columns = accumulator.computeIfAbsent(timestamp, ts -> new LinkedHashMap<>());
        String deviceSn = row.getString(DEVICE_SN);
        if (deviceSn == null || deviceSn.isEmpty()) {
            return;
        }
        for (String field : measurementFields) {
            if (row.contains(field)) {
                columns.put(deviceSn + "_" + field, row.get(field));
            }
        }

        if (includeExt) {
            Object payload = row.get(DeviceDataRepository.PAYLOAD_COLUMN);
            if (payload != null) {
                Map<String, Object> extracted = payloadFieldExtractor.extract(row.getString(DEVICE_TYPE), payload, config);
                extracted.forEach((name, value) -> columns.put(deviceSn + "_" + name, value));
            }
        }
    }

    private void mergeCommandRow(Row row, Map<Long, Map<String, Object>> accumulator) {
        Long timestamp = row.getLong(WideRow.TIMESTAMP_COLUMN);
        if (timestamp == null) {
            return;
        }
        Map<String, Object> columns = accumulator.computeIfAbsent(timestamp, ts -> new LinkedHashMap<>());
        String name = row.getString(COMMAND_NAME);
        if (name == null || name.isEmpty()) {
            return;
        }
        String deviceSn = row.getString(DEVICE_SN);
        // commands without a device keep their bare name; two such commands with the same name overwrite each other
        String column = deviceSn == null || deviceSn.isEmpty() ? name : deviceSn + "_" + name;
        columns.put(column, row.get(COMMAND_VALUE));
    }
}
