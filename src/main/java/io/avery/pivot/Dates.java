/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Lenient parsing of lead creation timestamps, and the labels derived from them.
 *
 * <p>Slash dates are read month first, as spreadsheet exports write them, so {@code 3/4/2024} is the 4th of March. A
 * slash date that is no valid month-first date, such as {@code 31/12/2022}, is read day first.
 */
final class Dates {
    private Dates() {} // Prevent instantiation

    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMM ''yy", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMMM", Locale.ENGLISH);

    // Tried in order. Offset forms first, so that a trailing zone is never silently dropped.
    private static final List<DateTimeFormatter> DATE_TIMES = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        strict("uuuu-MM-dd HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm")
    );
    private static final List<DateTimeFormatter> DATES = List.of(
        strict("uuuu-M-d"),
        strict("M/d/uuuu"),
        strict("d/M/uuuu"),
        strict("d-M-uuuu"),
        DateTimeFormatter.ofPattern("MMM d, uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT)
    );

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Returns the calendar date of the given timestamp value, or {@code null} if the value is absent or cannot be read
     * as a date. Temporal values are accepted as is; instants are read in UTC. Anything else is parsed from its string
     * form.
     */
    static LocalDate parse(Object value) {
        if (value == null)
            return null;
        if (value instanceof LocalDate)
            return (LocalDate) value;
        if (value instanceof LocalDateTime)
            return ((LocalDateTime) value).toLocalDate();
        if (value instanceof OffsetDateTime)
            return ((OffsetDateTime) value).toLocalDate();
        if (value instanceof ZonedDateTime)
            return ((ZonedDateTime) value).toLocalDate();
        if (value instanceof Instant)
            return LocalDate.ofInstant((Instant) value, ZoneOffset.UTC);
        String text = String.valueOf(value).trim();
        if (text.isEmpty())
            return null;
        for (DateTimeFormatter formatter : DATE_TIMES) {
            TemporalAccessor parsed = tryParse(text, formatter);
            if (parsed != null)
                return LocalDate.from(parsed);
        }
        for (DateTimeFormatter formatter : DATES) {
            TemporalAccessor parsed = tryParse(text, formatter);
            if (parsed != null)
                return LocalDate.from(parsed);
        }
        return null;
    }

    private static TemporalAccessor tryParse(String text, DateTimeFormatter formatter) {
        try {
            return formatter.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Abbreviated month and two-digit year, such as {@code Mar '24}. */
    static String monthYear(LocalDate date) {
        return MONTH_YEAR.format(date);
    }

    static String year(LocalDate date) {
        return String.valueOf(date.getYear());
    }

    /** Full month name, such as {@code March}. */
    static String month(LocalDate date) {
        return MONTH.format(date);
    }
}
