package dev.devanks.energy.pipeline.service;

import com.fasterxml.jackson.databind.ObjectReader;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.pipeline.exception.PipelineException;
import dev.devanks.energy.pipeline.mapper.MeasurementParser;
import dev.devanks.energy.pipeline.model.MeasurementBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static reactor.core.scheduler.Schedulers.boundedElastic;

@Service
@RequiredArgsConstructor
@Slf4j
public class MeasurementReaderService {

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    // Blank header cells (trailing delimiters) are named by position.
    static final String UNNAMED_COLUMN_PREFIX = "Unnamed: ";

    private final ObjectReader measurementCsvReader;
    private final MeasurementParser measurementParser;

    // Plain paths resolve to the filesystem rather than the classpath.
    private final ResourceLoader resourceLoader = new FileSystemResourceLoader();

    /**
     * Reads one input snapshot and parses every data row.
     *
     * @param location filesystem path, or a {@code file:} / {@code classpath:} location
     * @return a Mono emitting the parsed batch, or erroring with {@link PipelineException}
     * when the input is unreadable or its header is unusable
     */
    public Mono<MeasurementBatch> readMeasurements(String location) {
        return Mono.fromCallable(() -> {
                    log.info("Reading measurements from {} on thread: {}", location, Thread.currentThread().getName());
                    var resource = resourceLoader.getResource(location);
                    if (!resource.exists() || !resource.isReadable()) {
                        throw new PipelineException("Input location is not readable: " + location);
                    }
                    try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
                        return readBatch(reader, location);
                    }
                })
                .subscribeOn(boundedElastic())
                .doOnError(e -> log.error("Reading measurements from {} failed: {}", location, e.getMessage(), e))
                .onErrorMap(e -> e instanceof PipelineException
                        ? e
                        : new PipelineException("Failed to read input " + location, e));
    }

    @VisibleForTesting
    MeasurementBatch readBatch(Reader reader, String location) throws IOException {
        try (var rows = measurementCsvReader.<String[]>readValues(reader)) {
            if (!rows.hasNextValue()) {
                throw new PipelineException("Input " + location + " is empty, expected a header row.");
            }
            var columns = parseHeader(rows.nextValue(), location);
            var batch = MeasurementBatch.builder().columns(columns);

            long rowsRead = 0;
            long rowsRejected = 0;
            while (rows.hasNextValue()) {
                var cells = rows.nextValue();
                rowsRead++;
                var parsed = measurementParser.parse(toRawRow(columns, cells));
                if (parsed.isPresent()) {
                    batch.measurement(parsed.get());
                } else {
                    rowsRejected++;
                    log.warn("Rejected data row {} of {}: missing serial.", rowsRead, location);
                }
            }

            log.info("Read {} data rows from {} ({} rejected).", rowsRead, location, rowsRejected);
            return batch.rowsRead(rowsRead)
                    .rowsRejected(rowsRejected)
                    .build();
        }
    }

    private List<String> parseHeader(String[] header, String location) {
        var columns = new ArrayList<String>(header.length);
        var seen = new HashSet<String>();
        for (int i = 0; i < header.length; i++) {
            var column = header[i].trim();
            if (i == 0 && !column.isEmpty() && column.charAt(0) == BYTE_ORDER_MARK) {
                column = column.substring(1).trim();
            }
            if (column.isEmpty()) {
                column = UNNAMED_COLUMN_PREFIX + i;
            }
            if (!seen.add(column)) {
                throw new PipelineException("Input " + location + " has duplicate column '" + column + "'.");
            }
            columns.add(column);
        }

        var missing = MeasurementParser.REQUIRED_COLUMNS.stream()
                .filter(required -> !seen.contains(required))
                .toList();
        if (!missing.isEmpty()) {
            throw new PipelineException("Input " + location + " is missing required columns " + missing
                    + " (found " + columns + ").");
        }
        log.debug("Header of {}: {}", location, columns);
        return columns;
    }

    // Short rows are padded with empty text, cells beyond the header are ignored.
    private Map<String, String> toRawRow(List<String> columns, String[] cells) {
        var row = new LinkedHashMap<String, String>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), i < cells.length ? cells[i] : "");
        }
        return row;
    }
}
