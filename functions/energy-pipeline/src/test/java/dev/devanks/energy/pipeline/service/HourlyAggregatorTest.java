package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.HourlyBucket;
import dev.devanks.energy.pipeline.model.Measurement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static java.util.stream.Collectors.groupingBy;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HourlyAggregator Unit Tests")
class HourlyAggregatorTest {

    private final HourlyAggregator aggregator = new HourlyAggregator();

    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);

    private static Measurement reading(String serial, LocalDateTime timestamp, String purchase, String feedin) {
        return Measurement.builder()
                .serial(serial)
                .timestamp(timestamp)
                .gridPurchase(purchase == null ? null : new BigDecimal(purchase))
                .gridFeedin(feedin == null ? null : new BigDecimal(feedin))
                .directConsumption(BigDecimal.ONE)
                .build();
    }

    private static HourlyBucket bucket(List<HourlyBucket> buckets, LocalDate date, int hour) {
        return buckets.stream()
                .filter(b -> b.getDate().equals(date) && b.getHour() == hour)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No bucket for " + date + " hour " + hour));
    }

    @Test
    @DisplayName("aggregate: sums purchase per date and hour")
    void aggregate_sumsPerDateAndHour() {
        var measurements = List.of(
                reading("BAT1", DAY_1.atTime(3, 5), "5", "1"),
                reading("BAT1", DAY_1.atTime(3, 50), "10", "2"),
                reading("BAT1", DAY_2.atTime(3, 5), "0", "0"));

        var buckets = aggregator.aggregate(measurements);

        assertThat(buckets).hasSize(2);
        assertThat(bucket(buckets, DAY_1, 3).getGridPurchaseTotal()).isEqualByComparingTo("15");
        assertThat(bucket(buckets, DAY_1, 3).getGridFeedinTotal()).isEqualByComparingTo("3");
        assertThat(bucket(buckets, DAY_2, 3).getGridPurchaseTotal()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("aggregate: unknown values contribute zero while the other field still counts")
    void aggregate_unknownContributesZero() {
        var measurements = List.of(
                reading("A", DAY_1.atTime(8, 0), null, "4"),
                reading("B", DAY_1.atTime(8, 15), "2", null));

        var only = aggregator.aggregate(measurements).get(0);

        assertThat(only.getGridPurchaseTotal()).isEqualByComparingTo("2");
        assertThat(only.getGridFeedinTotal()).isEqualByComparingTo("4");
    }

    @Test
    @DisplayName("aggregate: records without timestamp are excluded and counted")
    void aggregate_unknownTimestampExcluded() {
        var measurements = List.of(
                reading("A", DAY_1.atTime(8, 0), "1", "1"),
                reading("A", null, "100", "100"));

        var buckets = aggregator.aggregate(measurements);

        assertThat(buckets).hasSize(1);
        assertThat(buckets.get(0).getGridPurchaseTotal()).isEqualByComparingTo("1");
        assertThat(aggregator.countUnattributed(measurements)).isEqualTo(1);
    }

    @Test
    @DisplayName("aggregate: flags the single highest feed-in hour of each date")
    void aggregate_flagsPeakPerDate() {
        var measurements = List.of(
                reading("A", DAY_1.atTime(11, 0), "0", "3"),
                reading("A", DAY_1.atTime(12, 0), "0", "7.5"),
                reading("A", DAY_1.atTime(13, 0), "0", "2"),
                reading("A", DAY_2.atTime(9, 0), "0", "1"));

        var buckets = aggregator.aggregate(measurements);

        assertThat(bucket(buckets, DAY_1, 11).isPeakFeedinHour()).isFalse();
        assertThat(bucket(buckets, DAY_1, 12).isPeakFeedinHour()).isTrue();
        assertThat(bucket(buckets, DAY_1, 13).isPeakFeedinHour()).isFalse();
        assertThat(bucket(buckets, DAY_2, 9).isPeakFeedinHour()).isTrue();
    }

    @Test
    @DisplayName("aggregate: every hour tied at the daily maximum is flagged")
    void aggregate_tiedPeaksAllFlagged() {
        var measurements = List.of(
                reading("A", DAY_1.atTime(10, 0), "0", "5"),
                reading("A", DAY_1.atTime(11, 0), "0", "2.5"),
                reading("B", DAY_1.atTime(11, 30), "0", "2.50"),
                reading("A", DAY_1.atTime(12, 0), "0", "4"));

        var buckets = aggregator.aggregate(measurements);

        assertThat(buckets)
                .filteredOn(HourlyBucket::isPeakFeedinHour)
                .extracting(HourlyBucket::getHour)
                .containsExactly(10, 11);
    }

    @Test
    @DisplayName("aggregate: a date whose feed-in is all unknown flags every hour at zero")
    void aggregate_allZeroFeedin_allFlagged() {
        var measurements = List.of(
                reading("A", DAY_1.atTime(1, 0), "1", null),
                reading("A", DAY_1.atTime(2, 0), "1", null));

        assertThat(aggregator.aggregate(measurements)).allMatch(HourlyBucket::isPeakFeedinHour);
    }

    @Test
    @DisplayName("aggregate: buckets come back ordered by date then hour")
    void aggregate_orderedByDateThenHour() {
        var measurements = List.of(
                reading("A", DAY_2.atTime(1, 0), "1", "1"),
                reading("A", DAY_1.atTime(23, 0), "1", "1"),
                reading("A", DAY_1.atTime(4, 0), "1", "1"));

        assertThat(aggregator.aggregate(measurements))
                .extracting(b -> b.getDate() + "/" + b.getHour())
                .containsExactly("2024-01-01/4", "2024-01-01/23", "2024-01-02/1");
    }

    @Test
    @DisplayName("aggregate: peak flags match the daily maximum on generated data")
    void aggregate_peakFlagsEqualDailyMaximum() {
        var random = new Random(42);
        var measurements = new ArrayList<Measurement>();
        for (int i = 0; i < 500; i++) {
            var timestamp = DAY_1.plusDays(random.nextInt(5)).atTime(random.nextInt(24), random.nextInt(60));
            measurements.add(reading("S" + random.nextInt(4), timestamp,
                    String.valueOf(random.nextInt(10)), String.valueOf(random.nextInt(4))));
        }

        var buckets = aggregator.aggregate(measurements);

        buckets.stream()
                .collect(groupingBy(HourlyBucket::getDate))
                .forEach((date, dayBuckets) -> {
                    var max = Collections.max(dayBuckets.stream().map(HourlyBucket::getGridFeedinTotal).toList());
                    dayBuckets.forEach(b -> assertThat(b.isPeakFeedinHour())
                            .as("peak flag of %s hour %d", date, b.getHour())
                            .isEqualTo(b.getGridFeedinTotal().compareTo(max) == 0));
                });
        assertThat(buckets).extracting(b -> b.getDate() + "/" + b.getHour()).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("aggregate: empty input gives no buckets")
    void aggregate_emptyInput() {
        assertThat(aggregator.aggregate(Collections.emptyList())).isEmpty();
    }
}
