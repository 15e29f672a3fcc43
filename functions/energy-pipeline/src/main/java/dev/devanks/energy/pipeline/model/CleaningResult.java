package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CleaningResult {
    @NonNull
    List<Measurement> measurements;
    long duplicatesRemoved;
    long emptyRemoved;
}
