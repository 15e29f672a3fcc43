package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.DeviceSummary;
import dev.devanks.energy.pipeline.model.Measurement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeviceSummarizer Unit Tests")
class DeviceSummarizerTest {

    private final DeviceSummarizer summarizer = new DeviceSummarizer();

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 3, 0);

    private static Measurement reading(String serial, LocalDateTime timestamp, String purchase, String feedin) {
        return Measurement.builder()
                .serial(serial)
                .timestamp(timestamp)
                .gridPurchase(purchase == null ? null : new BigDecimal(purchase))
                .gridFeedin(feedin == null ? null : new BigDecimal(feedin))
                .build();
    }

    @Test
    @DisplayName("summarize: sums lifetime totals per serial, timestamps irrelevant")
    void summarize_sumsPerSerial() {
        var measurements = List.of(
                reading("BAT1", T0, "5", "1"),
                reading("BAT1", T0.plusMinutes(10), "10", null),
                reading("BAT1", T0.plusDays(1), "0", "2"),
                reading("BAT1", null, null, "4"),
                reading("PV2", T0, "3", "0.5"));

        var summaries = summarizer.summarize(measurements);

        assertThat(summaries).hasSize(2);
        var bat1 = summaries.get(0);
        assertThat(bat1.getSerial()).isEqualTo("BAT1");
        assertThat(bat1.getGridPurchaseTotal()).isEqualByComparingTo("15");
        assertThat(bat1.getGridFeedinTotal()).isEqualByComparingTo("7");
        assertThat(summaries.get(1).getGridFeedinTotal()).isEqualByComparingTo("0.5");
    }

    @Test
    @DisplayName("summarize: orders by purchase total descending, ties by serial ascending")
    void summarize_rankedByPurchaseThenSerial() {
        var measurements = List.of(
                reading("C", T0, "2", "0"),
                reading("B", T0, "9", "0"),
                reading("A", T0, "2.0", "0"),
                reading("D", T0, "-1", "0"));

        assertThat(summarizer.summarize(measurements))
                .extracting(DeviceSummary::getSerial)
                .containsExactly("B", "A", "C", "D");
    }

    @Test
    @DisplayName("summarize: a device with only unknown purchase values totals zero")
    void summarize_unknownPurchaseOnly_totalsZero() {
        var only = summarizer.summarize(List.of(reading("X", T0, null, "1"))).get(0);

        assertThat(only.getGridPurchaseTotal()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("summarize: device totals add up to the grand total and are non-increasing")
    void summarize_grandTotalAndOrderInvariants() {
        var random = new Random(7);
        var measurements = new ArrayList<Measurement>();
        for (int i = 0; i < 300; i++) {
            var purchase = random.nextInt(5) == 0 ? null : random.nextInt(1000) / 100.0 + "";
            measurements.add(reading("S" + random.nextInt(12), T0.plusMinutes(i), purchase, "1"));
        }

        var summaries = summarizer.summarize(measurements);

        var grandTotal = measurements.stream()
                .map(Measurement::gridPurchaseOrZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        var summedTotals = summaries.stream()
                .map(DeviceSummary::getGridPurchaseTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(summedTotals).isEqualByComparingTo(grandTotal);

        for (int i = 1; i < summaries.size(); i++) {
            assertThat(summaries.get(i).getGridPurchaseTotal())
                    .isLessThanOrEqualTo(summaries.get(i - 1).getGridPurchaseTotal());
        }
        assertThat(summaries).extracting(DeviceSummary::getSerial).doesNotHaveDuplicates();
    }
}
