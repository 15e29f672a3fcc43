package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * The three datasets of one run, ready to be written.
 */
@Value
@Builder
public class PipelineOutputs {
    @NonNull
    List<String> columns;
    @NonNull
    List<Measurement> cleaned;
    @NonNull
    List<HourlyBucket> hourlyBuckets;
    @NonNull
    List<DeviceSummary> deviceSummaries;
}
