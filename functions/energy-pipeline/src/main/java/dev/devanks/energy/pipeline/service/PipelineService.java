package dev.devanks.energy.pipeline.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.pipeline.config.PipelineProperties;
import dev.devanks.energy.pipeline.exception.PipelineException;
import dev.devanks.energy.pipeline.model.CleaningResult;
import dev.devanks.energy.pipeline.model.DeviceSummary;
import dev.devanks.energy.pipeline.model.HourlyBucket;
import dev.devanks.energy.pipeline.model.MeasurementBatch;
import dev.devanks.energy.pipeline.model.PipelineOutputs;
import dev.devanks.energy.pipeline.model.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static dev.devanks.energy.pipeline.model.PipelineResult.Status.SUCCESS;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineService {

    private final PipelineProperties properties;
    private final MeasurementReaderService readerService;
    private final MeasurementCleaner cleaner;
    private final HourlyAggregator hourlyAggregator;
    private final DeviceSummarizer deviceSummarizer;
    private final OutputWriterService writerService;

    /**
     * Runs the pipeline against the configured input location.
     *
     * @return A Mono containing the run report.
     */
    public Mono<PipelineResult> runPipeline() {
        return runPipeline(properties.getInput().getLocation());
    }

    /**
     * Reads one snapshot, cleans it, aggregates it and writes the three datasets. Any failure
     * surfaces as a {@link PipelineException}.
     *
     * @param inputLocation the snapshot to process
     * @return A Mono containing the run report.
     */
    public Mono<PipelineResult> runPipeline(String inputLocation) {
        return Mono.defer(() -> {
                    var start = Instant.now();
                    log.info("Starting measurement pipeline for input {}.", inputLocation);
                    return readerService.readMeasurements(inputLocation)
                            .flatMap(batch -> transformAndWrite(batch, inputLocation, start));
                })
                .doOnError(e -> log.error("Measurement pipeline for input {} failed: {}", inputLocation, e.getMessage(), e))
                .onErrorMap(e -> e instanceof PipelineException
                        ? e
                        : new PipelineException("Pipeline run failed for " + inputLocation + ": " + e.getMessage(), e));
    }

    private Mono<PipelineResult> transformAndWrite(MeasurementBatch batch, String inputLocation, Instant start) {
        var cleaning = cleaner.clean(batch.getMeasurements());
        var kept = cleaning.getMeasurements();
        List<HourlyBucket> hourlyBuckets = hourlyAggregator.aggregate(kept);
        List<DeviceSummary> deviceSummaries = deviceSummarizer.summarize(kept);
        long unattributed = hourlyAggregator.countUnattributed(kept);

        log.info("Cleaning kept {} of {} measurements; {} hourly buckets, {} devices.",
                kept.size(), batch.getMeasurements().size(), hourlyBuckets.size(), deviceSummaries.size());

        var outputs = PipelineOutputs.builder()
                .columns(batch.getColumns())
                .cleaned(kept)
                .hourlyBuckets(hourlyBuckets)
                .deviceSummaries(deviceSummaries)
                .build();

        return writerService.writeOutputs(outputs)
                .map(locations -> buildResult(batch, cleaning, outputs, unattributed, locations, inputLocation, start));
    }

    @VisibleForTesting
    PipelineResult buildResult(MeasurementBatch batch, CleaningResult cleaning, PipelineOutputs outputs,
                               long unattributed, List<String> locations, String inputLocation, Instant start) {
        long duration = ChronoUnit.MILLIS.between(start, Instant.now());
        var result = PipelineResult.builder()
                .status(SUCCESS)
                .message(String.format("Pipeline completed in %d ms.", duration))
                .durationMs(duration)
                .inputLocation(inputLocation)
                .rowsRead(batch.getRowsRead())
                .rowsRejected(batch.getRowsRejected())
                .duplicatesRemoved(cleaning.getDuplicatesRemoved())
                .emptyRowsRemoved(cleaning.getEmptyRemoved())
                .measurementsKept((long) outputs.getCleaned().size())
                .unattributedMeasurements(unattributed)
                .hourlyBuckets((long) outputs.getHourlyBuckets().size())
                .devices((long) outputs.getDeviceSummaries().size())
                .outputLocations(locations)
                .build();
        log.info("Measurement pipeline result: {}", result);
        return result;
    }
}
