package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.CleaningResult;
import dev.devanks.energy.pipeline.model.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

@Component
@Slf4j
public class MeasurementCleaner {

    /**
     * Drops exact duplicates (first occurrence wins), then drops measurements whose three
     * energy values are all unknown. Surviving measurements keep their input order.
     *
     * @param measurements parsed measurements in input order
     * @return the surviving measurements and how many each filter removed
     */
    public CleaningResult clean(List<Measurement> measurements) {
        var distinct = new LinkedHashSet<>(measurements);
        long duplicatesRemoved = measurements.size() - distinct.size();

        List<Measurement> kept = distinct.stream()
                .filter(Measurement::hasAnyEnergyValue)
                .toList();
        long emptyRemoved = distinct.size() - kept.size();

        log.debug("Cleaning kept {} of {} measurements ({} duplicates, {} without energy values).",
                kept.size(), measurements.size(), duplicatesRemoved, emptyRemoved);

        return CleaningResult.builder()
                .measurements(kept)
                .duplicatesRemoved(duplicatesRemoved)
                .emptyRemoved(emptyRemoved)
                .build();
    }
}
