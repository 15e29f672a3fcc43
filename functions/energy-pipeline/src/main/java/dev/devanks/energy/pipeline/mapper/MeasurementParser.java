package dev.devanks.energy.pipeline.mapper;

import dev.devanks.energy.pipeline.model.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.time.format.SignStyle.NOT_NEGATIVE;
import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;

/**
 * Turns one raw input row into a {@link Measurement}. Bad numbers and bad timestamps become
 * unknown values; only a row without a serial is rejected.
 */
@Component
@Slf4j
public class MeasurementParser {

    public static final String SERIAL = "serial";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATE = "date";
    public static final String GRID_PURCHASE = "grid_purchase";
    public static final String GRID_FEEDIN = "grid_feedin";
    public static final String DIRECT_CONSUMPTION = "direct_consumption";
    /**
     * Always derived from the timestamp; an input column of this name is not carried through.
     */
    public static final String HOUR = "hour";

    public static final List<String> REQUIRED_COLUMNS =
            List.of(SERIAL, TIMESTAMP, DATE, GRID_PURCHASE, GRID_FEEDIN, DIRECT_CONSUMPTION);

    private static final Set<String> CANONICAL_COLUMNS =
            Set.of(SERIAL, TIMESTAMP, DATE, GRID_PURCHASE, GRID_FEEDIN, DIRECT_CONSUMPTION, HOUR);

    // Non-zero values must fit the double range, which also bounds the exponent for later sums.
    private static final BigDecimal MAX_MAGNITUDE = new BigDecimal(Double.MAX_VALUE);
    private static final BigDecimal MIN_MAGNITUDE = new BigDecimal(Double.MIN_VALUE);

    // Tried in order; offsets are accepted but dropped, the wall-clock time is kept.
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
            dateTimeFormat(dashDate(), 'T'),
            dateTimeFormat(dashDate(), ' '),
            strict(dashDate().parseDefaulting(HOUR_OF_DAY, 0)),
            dateTimeFormat(builder().appendPattern("uuuu/M/d"), ' '),
            dateTimeFormat(builder().appendPattern("M/d/uuuu"), ' ')
    );

    public Optional<Measurement> parse(Map<String, String> row) {
        var serial = row.get(SERIAL);
        if (serial == null || serial.isBlank()) {
            log.debug("Rejecting row without serial: {}", row);
            return Optional.empty();
        }

        return Optional.of(Measurement.builder()
                .serial(serial)
                .timestamp(parseTimestamp(row.get(TIMESTAMP)))
                .gridPurchase(parseDecimal(row.get(GRID_PURCHASE)))
                .gridFeedin(parseDecimal(row.get(GRID_FEEDIN)))
                .directConsumption(parseDecimal(row.get(DIRECT_CONSUMPTION)))
                .extras(extraColumns(row))
                .build());
    }

    /**
     * Parses a finite decimal number. Anything else, including blanks and non-zero values whose
     * magnitude lies outside {@code [Double.MIN_VALUE, Double.MAX_VALUE]}, yields {@code null}. Negative values pass through untouched.
     */
    BigDecimal parseDecimal(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            var value = new BigDecimal(text.trim());
            if (value.signum() == 0) {
                return BigDecimal.ZERO;
            }
            var magnitude = value.abs();
            if (magnitude.compareTo(MAX_MAGNITUDE) > 0 || magnitude.compareTo(MIN_MAGNITUDE) < 0) {
                log.debug("Numeric value out of range, treating as unknown: {}", text);
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            log.debug("Unparseable numeric value, treating as unknown: '{}'", text);
            return null;
        }
    }

    LocalDateTime parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        var trimmed = text.trim();
        for (var format : TIMESTAMP_FORMATS) {
            var parsed = tryParse(format, trimmed);
            if (parsed != null) {
                return parsed;
            }
        }
        log.debug("Unparseable timestamp, treating as unknown: '{}'", text);
        return null;
    }

    private static LocalDateTime tryParse(DateTimeFormatter format, String text) {
        try {
            return format.parse(text, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            log.trace("Timestamp '{}' does not match {}", text, format);
            return null;
        }
    }

    private Map<String, String> extraColumns(Map<String, String> row) {
        var extras = new LinkedHashMap<String, String>();
        row.forEach((column, value) -> {
            if (!CANONICAL_COLUMNS.contains(column)) {
                extras.put(column, value);
            }
        });
        return extras;
    }

    // Year is four digits; month, day and hour may drop their leading zero.
    private static DateTimeFormatterBuilder dashDate() {
        return builder()
                .appendValue(YEAR, 4)
                .appendLiteral('-')
                .appendValue(MONTH_OF_YEAR, 1, 2, NOT_NEGATIVE)
                .appendLiteral('-')
                .appendValue(DAY_OF_MONTH, 1, 2, NOT_NEGATIVE);
    }

    private static DateTimeFormatter dateTimeFormat(DateTimeFormatterBuilder date, char separator) {
        return strict(date
                .appendLiteral(separator)
                .appendValue(HOUR_OF_DAY, 1, 2, NOT_NEGATIVE)
                .appendLiteral(':')
                .appendValue(MINUTE_OF_HOUR, 2)
                .optionalStart()
                .appendLiteral(':')
                .appendValue(SECOND_OF_MINUTE, 2)
                .optionalStart().appendFraction(NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd()
                .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd());
    }

    private static DateTimeFormatterBuilder builder() {
        return new DateTimeFormatterBuilder().parseCaseInsensitive();
    }

    private static DateTimeFormatter strict(DateTimeFormatterBuilder builder) {
        return builder
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
