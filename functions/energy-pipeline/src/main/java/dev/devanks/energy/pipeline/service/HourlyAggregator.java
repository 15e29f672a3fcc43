package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.HourlyBucket;
import dev.devanks.energy.pipeline.model.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;

@Component
@Slf4j
public class HourlyAggregator {

    /**
     * Sums purchase and feed-in per (date, hour) and flags, for every date, each hour whose
     * feed-in total equals that date's maximum. Tied hours are all flagged.
     * <p>
     * Measurements with an unknown timestamp cannot be attributed to a bucket and are left out.
     * Buckets come back ordered by date, then hour.
     *
     * @param measurements cleaned measurements
     * @return one bucket per (date, hour) present
     */
    public List<HourlyBucket> aggregate(List<Measurement> measurements) {
        long unattributed = countUnattributed(measurements);
        if (unattributed > 0) {
            log.info("{} measurements have no usable timestamp and are excluded from hourly totals.", unattributed);
        }

        var byDateAndHour = measurements.stream()
                .filter(Measurement::hasKnownTimestamp)
                .collect(groupingBy(
                        m -> m.getDate().orElseThrow(),
                        TreeMap::new,
                        groupingBy(m -> m.getHour().orElseThrow(), TreeMap::new, toList())
                ));

        var buckets = new ArrayList<HourlyBucket>();
        byDateAndHour.forEach((date, hours) -> buckets.addAll(bucketsForDate(date, hours)));

        log.debug("Built {} hourly buckets over {} dates.", buckets.size(), byDateAndHour.size());
        return List.copyOf(buckets);
    }

    public long countUnattributed(List<Measurement> measurements) {
        return measurements.stream()
                .filter(m -> !m.hasKnownTimestamp())
                .count();
    }

    private List<HourlyBucket> bucketsForDate(LocalDate date, Map<Integer, List<Measurement>> hours) {
        Map<Integer, BigDecimal> purchaseTotals = new TreeMap<>();
        Map<Integer, BigDecimal> feedinTotals = new TreeMap<>();
        hours.forEach((hour, members) -> {
            purchaseTotals.put(hour, EnergyTotals.sum(members, Measurement::gridPurchaseOrZero));
            feedinTotals.put(hour, EnergyTotals.sum(members, Measurement::gridFeedinOrZero));
        });

        BigDecimal peakFeedin = feedinTotals.values().stream()
                .max(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);

        return hours.keySet().stream()
                .map(hour -> HourlyBucket.builder()
                        .date(date)
                        .hour(hour)
                        .gridPurchaseTotal(purchaseTotals.get(hour))
                        .gridFeedinTotal(feedinTotals.get(hour))
                        .peakFeedinHour(feedinTotals.get(hour).compareTo(peakFeedin) == 0)
                        .build())
                .toList();
    }
}
