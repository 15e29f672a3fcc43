package dev.devanks.energy.pipeline.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.pipeline.config.PipelineProperties;
import dev.devanks.energy.pipeline.exception.PipelineException;
import dev.devanks.energy.pipeline.model.DeviceSummary;
import dev.devanks.energy.pipeline.model.HourlyBucket;
import dev.devanks.energy.pipeline.model.Measurement;
import dev.devanks.energy.pipeline.model.PipelineOutputs;
import dev.devanks.energy.pipeline.service.io.OutputTarget;
import dev.devanks.energy.pipeline.service.io.OutputTargetProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import static dev.devanks.energy.pipeline.mapper.MeasurementParser.DATE;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.DIRECT_CONSUMPTION;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.GRID_FEEDIN;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.GRID_PURCHASE;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.HOUR;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.SERIAL;
import static dev.devanks.energy.pipeline.mapper.MeasurementParser.TIMESTAMP;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_TIME;
import static reactor.core.scheduler.Schedulers.boundedElastic;

@Service
@RequiredArgsConstructor
@Slf4j
public class OutputWriterService {

    static final List<String> HOURLY_HEADER =
            List.of("date", "hour", "grid_purchase_total", "grid_feedin_total", "is_peak_feedin_hour");
    static final List<String> SUMMARY_HEADER =
            List.of("serial", "grid_purchase_total", "grid_feedin_total");

    private final PipelineProperties properties;
    private final OutputTargetProvider targetProvider;

    /**
     * Writes the cleaned records, hourly buckets and device summaries. All three files are
     * staged first and only published once every one of them has been written completely.
     * A staging failure removes the staged files and leaves the previous outputs in place.
     *
     * @param outputs the datasets of one run
     * @return a Mono emitting the published locations (cleaned, hourly, summary)
     */
    public Mono<List<String>> writeOutputs(PipelineOutputs outputs) {
        var output = properties.getOutput();
        return Mono.fromCallable(() -> {
                    var contents = List.of(
                            Map.entry(output.getCleanedLocation(), renderCleaned(outputs.getColumns(), outputs.getCleaned())),
                            Map.entry(output.getHourlyLocation(), renderHourly(outputs.getHourlyBuckets())),
                            Map.entry(output.getSummaryLocation(), renderSummary(outputs.getDeviceSummaries())));
                    log.info("Writing {} cleaned measurements, {} hourly buckets and {} device summaries on thread: {}",
                            outputs.getCleaned().size(), outputs.getHourlyBuckets().size(),
                            outputs.getDeviceSummaries().size(), Thread.currentThread().getName());
                    return stageAndPublish(contents);
                })
                .subscribeOn(boundedElastic())
                .doOnError(e -> log.error("Writing pipeline outputs failed: {}", e.getMessage(), e))
                .onErrorMap(e -> e instanceof PipelineException
                        ? e
                        : new PipelineException("Output write failed: " + e.getMessage(), e));
    }

    private List<String> stageAndPublish(List<Map.Entry<String, String>> contents) throws IOException {
        List<OutputTarget> staged = new ArrayList<>();
        try {
            for (var entry : contents) {
                var target = targetProvider.createTarget(entry.getKey());
                staged.add(target);
                try (Writer writer = new OutputStreamWriter(target.getOutputStream(), StandardCharsets.UTF_8)) {
                    writer.write(entry.getValue());
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Discarding {} staged output files after failure.", staged.size());
            staged.forEach(OutputTarget::discard);
            throw e;
        }

        List<String> published = new ArrayList<>();
        for (int i = 0; i < staged.size(); i++) {
            var target = staged.get(i);
            try {
                target.publish();
            } catch (IOException e) {
                log.error("Publishing {} failed after {} outputs were already published: {}",
                        target.getLocation(), published, e.getMessage());
                staged.subList(i, staged.size()).forEach(OutputTarget::discard);
                throw e;
            }
            published.add(target.getLocation());
        }
        log.info("Published pipeline outputs: {}", published);
        return published;
    }

    @VisibleForTesting
    String renderCleaned(List<String> columns, List<Measurement> measurements) {
        // An input hour column is replaced by the derived one at the end.
        var inputColumns = columns.stream()
                .filter(column -> !HOUR.equals(column))
                .toList();
        var csv = new StringBuilder();
        var header = new ArrayList<>(inputColumns);
        header.add(HOUR);
        appendRow(csv, header);
        for (var measurement : measurements) {
            List<String> cells = new ArrayList<>(inputColumns.size() + 1);
            for (var column : inputColumns) {
                cells.add(cleanedCell(measurement, column));
            }
            cells.add(measurement.getHour().map(String::valueOf).orElse(""));
            appendRow(csv, cells);
        }
        return csv.toString();
    }

    @VisibleForTesting
    String renderHourly(List<HourlyBucket> buckets) {
        var csv = new StringBuilder();
        appendRow(csv, HOURLY_HEADER);
        for (var bucket : buckets) {
            appendRow(csv, List.of(
                    bucket.getDate().toString(),
                    String.valueOf(bucket.getHour()),
                    bucket.getGridPurchaseTotal().toPlainString(),
                    bucket.getGridFeedinTotal().toPlainString(),
                    String.valueOf(bucket.isPeakFeedinHour())));
        }
        return csv.toString();
    }

    @VisibleForTesting
    String renderSummary(List<DeviceSummary> summaries) {
        var csv = new StringBuilder();
        appendRow(csv, SUMMARY_HEADER);
        for (var summary : summaries) {
            appendRow(csv, List.of(
                    summary.getSerial(),
                    summary.getGridPurchaseTotal().toPlainString(),
                    summary.getGridFeedinTotal().toPlainString()));
        }
        return csv.toString();
    }

    private String cleanedCell(Measurement measurement, String column) {
        return switch (column) {
            case SERIAL -> measurement.getSerial();
            case TIMESTAMP -> measurement.getTimestamp().map(OutputWriterService::formatTimestamp).orElse("");
            case DATE -> measurement.getDate().map(Object::toString).orElse("");
            case GRID_PURCHASE -> plain(measurement.getGridPurchase());
            case GRID_FEEDIN -> plain(measurement.getGridFeedin());
            case DIRECT_CONSUMPTION -> plain(measurement.getDirectConsumption());
            default -> measurement.getExtras().getOrDefault(column, "");
        };
    }

    // Unknown is an empty field, never 0.
    private static String plain(Optional<BigDecimal> value) {
        return value.map(BigDecimal::toPlainString).orElse("");
    }

    private static String formatTimestamp(LocalDateTime timestamp) {
        return timestamp.toLocalDate() + " " + timestamp.toLocalTime().format(ISO_LOCAL_TIME);
    }

    private void appendRow(StringBuilder csv, List<String> cells) {
        var delimiter = properties.getOutput().getDelimiter();
        var joiner = new StringJoiner(String.valueOf(delimiter));
        for (var cell : cells) {
            joiner.add(escapeCsvField(cell, delimiter));
        }
        csv.append(joiner).append('\n');
    }

    private String escapeCsvField(String field, char delimiter) {
        if (field == null) {
            return "";
        }
        if (field.indexOf(delimiter) >= 0 || field.contains("\n") || field.contains("\r") || field.contains("\"")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
