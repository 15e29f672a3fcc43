package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything parsed out of one input snapshot.
 */
@Value
@Builder
public class MeasurementBatch {
    /**
     * Header columns in input order.
     */
    @NonNull
    @Singular
    List<String> columns;
    @NonNull
    @Singular
    List<Measurement> measurements;
    long rowsRead;
    long rowsRejected;
}
