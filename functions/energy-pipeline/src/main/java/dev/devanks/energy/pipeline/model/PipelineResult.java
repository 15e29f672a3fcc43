package dev.devanks.energy.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL) // errorDetails only on failure, counters only on success
public class PipelineResult {

    public enum Status {
        SUCCESS, FAILURE
    }

    private Status status;
    private String message;
    private Long durationMs;
    private String inputLocation;
    private Long rowsRead;
    private Long rowsRejected;
    private Long duplicatesRemoved;
    private Long emptyRowsRemoved;
    private Long measurementsKept;
    private Long unattributedMeasurements;
    private Long hourlyBuckets;
    private Long devices;
    private List<String> outputLocations;
    private String errorDetails; // Only populated on failure

}
