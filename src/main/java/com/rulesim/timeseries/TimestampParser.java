package com.rulesim.timeseries;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parses the {@code T} column of feature files.
 *
 * <p>Accepts {@code yyyy-MM-dd}, {@code yyyy-MM-dd HH:mm[:ss[.fraction]]} and the same
 * with a {@code T} separator. Date-only values resolve to midnight.
 */
public final class TimestampParser {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart()
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .optionalStart()
            .appendLiteral('T')
            .optionalEnd()
            .appendPattern("HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private TimestampParser() {}

    /**
     * @throws DateTimeParseException if the value is not an ISO-like date or date-time
     */
    public static LocalDateTime parse(String value) {
        return LocalDateTime.parse(value.trim(), FORMAT);
    }
}
