package dev.devanks.energy.pipeline.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One typed energy reading. Every value except {@code serial} may be unknown, which is kept
 * apart from a measured zero. {@code date} and {@code hour} are always derived from
 * {@code timestamp} and are unknown exactly when it is.
 * <p>
 * Energy values are stored without trailing zeros so that equality is numeric
 * ({@code 10} and {@code 10.0} are the same reading).
 */
@ToString
@EqualsAndHashCode
public final class Measurement {

    private final String serial;
    private final LocalDateTime timestamp;
    private final LocalDate date;
    private final Integer hour;
    private final BigDecimal gridPurchase;
    private final BigDecimal gridFeedin;
    private final BigDecimal directConsumption;
    private final Map<String, String> extras;

    @Builder
    private Measurement(@NonNull String serial,
                        LocalDateTime timestamp,
                        BigDecimal gridPurchase,
                        BigDecimal gridFeedin,
                        BigDecimal directConsumption,
                        Map<String, String> extras) {
        this.serial = serial;
        this.timestamp = timestamp;
        this.date = timestamp != null ? timestamp.toLocalDate() : null;
        this.hour = timestamp != null ? timestamp.getHour() : null;
        this.gridPurchase = normalize(gridPurchase);
        this.gridFeedin = normalize(gridFeedin);
        this.directConsumption = normalize(directConsumption);
        this.extras = extras == null || extras.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public String getSerial() {
        return serial;
    }

    public Optional<LocalDateTime> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<LocalDate> getDate() {
        return Optional.ofNullable(date);
    }

    public Optional<Integer> getHour() {
        return Optional.ofNullable(hour);
    }

    public Optional<BigDecimal> getGridPurchase() {
        return Optional.ofNullable(gridPurchase);
    }

    public Optional<BigDecimal> getGridFeedin() {
        return Optional.ofNullable(gridFeedin);
    }

    public Optional<BigDecimal> getDirectConsumption() {
        return Optional.ofNullable(directConsumption);
    }

    /**
     * Raw text of the non-canonical input columns, in header order.
     */
    public Map<String, String> getExtras() {
        return extras;
    }

    public boolean hasKnownTimestamp() {
        return timestamp != null;
    }

    public boolean hasAnyEnergyValue() {
        return gridPurchase != null || gridFeedin != null || directConsumption != null;
    }

    /**
     * Purchase value for summation: unknown counts as zero.
     */
    public BigDecimal gridPurchaseOrZero() {
        return gridPurchase != null ? gridPurchase : BigDecimal.ZERO;
    }

    /**
     * Feed-in value for summation: unknown counts as zero.
     */
    public BigDecimal gridFeedinOrZero() {
        return gridFeedin != null ? gridFeedin : BigDecimal.ZERO;
    }

    private static BigDecimal normalize(BigDecimal value) {
        return value != null ? value.stripTrailingZeros() : null;
    }
}
