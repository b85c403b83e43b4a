package com.samsung.ees.infra.api.remotedb.controller;

import com.samsung.ees.infra.api.remotedb.config.ExtractionConfigLoader;
import com.samsung.ees.infra.api.remotedb.dto.RemoteQueryRequest;
import com.samsung.ees.infra.api.remotedb.exception.NoDataFoundException;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.model.TableInfo;
import com.samsung.ees.infra.api.remotedb.model.WideRow;
import com.samsung.ees.infra.api.remotedb.repository.CommandDataRepository;
import com.samsung.ees.infra.api.remotedb.repository.DatabaseInfoRepository;
import com.samsung.ees.infra.api.remotedb.repository.DeviceDataRepository;
import com.samsung.ees.infra.api.remotedb.service.WideTableParquetService;
import com.samsung.ees.infra.api.remotedb.widetable.PayloadFieldExtractor;
import com.samsung.ees.infra.api.remotedb.widetable.WideTableService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST endpoints over the remote device database.
 * Every remote call blocks, so each one runs on the bounded elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/remote-db")
@RequiredArgsConstructor
public class RemoteQueryController {
    private final DeviceDataRepository deviceDataRepository;
    private final CommandDataRepository commandDataRepository;
    private final DatabaseInfoRepository databaseInfoRepository;
    private final WideTableService wideTableService;
    private final WideTableParquetService wideTableParquetService;
    private final PayloadFieldExtractor payloadFieldExtractor;
    private final ExtractionConfigLoader extractionConfigLoader;

    @GetMapping("/tables")
    public Mono<TableInfo> describe(@RequestParam("dbPath") String dbPath) {
        log.info("Received request to describe database {}", dbPath);
        return blocking(() -> databaseInfoRepository.describe(dbPath));
    }

    @GetMapping("/device-data")
    public Mono<RowSet> deviceData(@Valid RemoteQueryRequest request) {
        log.info("Received request for device data in {} from {} to {} (device: {}, ext: {})",
                request.getDbPath(), request.getStartTime(), request.getEndTime(), request.getDeviceSn(), request.isIncludeExt());
        return blocking(() -> {
            RowSet rows = deviceDataRepository.findByTimeRange(request.getDbPath(), request.getStartTime(),
                    request.getEndTime(), request.getDeviceSn(), request.isIncludeExt());
            return request.isFlatten() ? payloadFieldExtractor.flatten(rows, extractionConfigLoader.getConfig()) : rows;
        });
    }

    @GetMapping("/command-data")
    public Mono<RowSet> commandData(@Valid RemoteQueryRequest request) {
        log.info("Received request for command data in {} from {} to {} (device: {})",
                request.getDbPath(), request.getStartTime(), request.getEndTime(), request.getDeviceSn());
        return blocking(() -> commandDataRepository.findByTimeRange(request.getDbPath(), request.getStartTime(),
                request.getEndTime(), request.getDeviceSn()));
    }

    @GetMapping("/wide-table")
    public Mono<List<WideRow>> wideTable(@Valid RemoteQueryRequest request) {
        log.info("Received request for wide table in {} from {} to {} (ext: {})",
                request.getDbPath(), request.getStartTime(), request.getEndTime(), request.isIncludeExt());
        return blocking(() -> buildWideTable(request));
    }

    @GetMapping("/wide-table/parquet")
    public Mono<ResponseEntity<byte[]>> exportWideTable(@Valid RemoteQueryRequest request) {
        log.info("Received request to export wide table in {} from {} to {}",
                request.getDbPath(), request.getStartTime(), request.getEndTime());
        Flux<WideRow> wideRows = blocking(() -> buildWideTable(request)).flatMapMany(Flux::fromIterable);
        return wideTableParquetService.convertToParquet(wideRows)
                .map(parquetBytes -> {
                    if (parquetBytes.length == 0) {
                        throw new NoDataFoundException(request.getDbPath(), request.getStartTime(), request.getEndTime());
                    }

                    HttpHeaders headers = new HttpHeaders();
                    headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
                    headers.setContentDispositionFormData("attachment", "wide_table.parquet");
                    headers.setContentLength(parquetBytes.length);

                    log.info("Successfully generated Parquet file of size: {} bytes", parquetBytes.length);
                    return new ResponseEntity<>(parquetBytes, headers, HttpStatus.OK);
                });
    }

    private List<WideRow> buildWideTable(RemoteQueryRequest request) {
        return wideTableService.buildWideTable(request.getDbPath(), request.getStartTime(), request.getEndTime(),
                request.isIncludeExt(), (stage, percent) -> log.debug("Wide table {}: {}%", stage, Math.round(percent)));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
