package dev.devanks.energy.pipeline.service;

import dev.devanks.energy.pipeline.model.Measurement;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

final class EnergyTotals {

    private EnergyTotals() {
    }

    static BigDecimal sum(List<Measurement> members, Function<Measurement, BigDecimal> value) {
        return members.stream()
                .map(value)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
