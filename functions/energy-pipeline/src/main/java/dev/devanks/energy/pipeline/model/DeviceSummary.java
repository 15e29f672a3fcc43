package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DeviceSummary {
    @NonNull
    String serial;
    @NonNull
    BigDecimal gridPurchaseTotal;
    @NonNull
    BigDecimal gridFeedinTotal;
}
