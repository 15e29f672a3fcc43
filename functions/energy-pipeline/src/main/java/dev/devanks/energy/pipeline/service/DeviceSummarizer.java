package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.DeviceSummary;
import dev.devanks.energy.pipeline.model.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

import static java.util.stream.Collectors.groupingBy;

@Component
@Slf4j
public class DeviceSummarizer {

    // Highest purchase first; equal totals fall back to serial so the order is stable across runs.
    static final Comparator<DeviceSummary> RANKING = Comparator
            .comparing(DeviceSummary::getGridPurchaseTotal, Comparator.reverseOrder())
            .thenComparing(DeviceSummary::getSerial);

    /**
     * Lifetime purchase and feed-in totals per device, ranked by purchase total.
     *
     * @param measurements cleaned measurements
     * @return one summary per serial
     */
    public List<DeviceSummary> summarize(List<Measurement> measurements) {
        List<DeviceSummary> summaries = measurements.stream()
                .collect(groupingBy(Measurement::getSerial))
                .entrySet().stream()
                .map(entry -> DeviceSummary.builder()
                        .serial(entry.getKey())
                        .gridPurchaseTotal(EnergyTotals.sum(entry.getValue(), Measurement::gridPurchaseOrZero))
                        .gridFeedinTotal(EnergyTotals.sum(entry.getValue(), Measurement::gridFeedinOrZero))
                        .build())
                .sorted(RANKING)
                .toList();

        log.debug("Summarized {} devices.", summaries.size());
        return summaries;
    }
}
