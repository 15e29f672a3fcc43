package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class HourlyBucket {
    @NonNull
    LocalDate date;
    int hour;
    @NonNull
    BigDecimal gridPurchaseTotal;
    @NonNull
    BigDecimal gridFeedinTotal;
    boolean peakFeedinHour;
}
