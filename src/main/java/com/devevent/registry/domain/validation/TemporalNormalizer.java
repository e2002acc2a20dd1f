package com.devevent.registry.domain.validation;

import com.devevent.registry.domain.model.ErrorKind;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts free-form date and time input into the stored canonical forms:
 * {@code YYYY-MM-DD} for dates and zero-padded 24-hour {@code HH:MM} for times.
 * Date-times without an offset are read as UTC.
 */
public final class TemporalNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TemporalNormalizer.class);

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{1,2})(?::\\d{2})?$");

    // Tried in order; the first parser that accepts the input wins.
    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE),
            value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDate(),
            value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME)
                    .withZoneSameInstant(ZoneOffset.UTC)
                    .toLocalDate(),
            calendarDateTime("uuuu-MM-dd HH:mm[:ss]"),
            calendarDate("uuuu/M/d"),
            calendarDate("M/d/uuuu"),
            calendarDate("MMMM d, uuuu"),
            calendarDate("MMM d, uuuu"),
            calendarDate("MMMM d uuuu"),
            calendarDate("MMM d uuuu"),
            calendarDate("d MMMM uuuu"),
            calendarDate("d MMM uuuu")
    );

    private TemporalNormalizer() {
    }

    public static String normalizeDate(String raw) {
        String value = FieldValidator.trimWhitespace(raw);
        if (value == null || value.isEmpty()) {
            throw invalidDate(raw);
        }

        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return DateTimeFormatter.ISO_LOCAL_DATE.format(parser.apply(value));
            } catch (DateTimeException e) {
                // includes year overflow after the shift to UTC
                logger.trace("Date '{}' rejected by parser: {}", value, e.getMessage());
            }
        }
        throw invalidDate(raw);
    }

    public static String normalizeTime(String raw) {
        Matcher match = raw == null ? null : TIME_PATTERN.matcher(FieldValidator.trimWhitespace(raw));
        if (match == null || !match.matches()) {
            throw new TemporalNormalizationException(ErrorKind.INVALID_TIME_FORMAT, "Time must be in HH:mm format.");
        }

        int hours = Integer.parseInt(match.group(1));
        int minutes = Integer.parseInt(match.group(2));
        if (hours > 23 || minutes > 59) {
            throw new TemporalNormalizationException(ErrorKind.INVALID_TIME_VALUE, "Invalid time value.");
        }
        return String.format(Locale.ROOT, "%02d:%02d", hours, minutes);
    }

    private static Function<String, LocalDate> calendarDate(String pattern) {
        DateTimeFormatter format = strictFormatter(pattern);
        return value -> LocalDate.parse(value, format);
    }

    private static Function<String, LocalDate> calendarDateTime(String pattern) {
        DateTimeFormatter format = strictFormatter(pattern);
        return value -> LocalDateTime.parse(value, format).toLocalDate();
    }

    private static DateTimeFormatter strictFormatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static TemporalNormalizationException invalidDate(String raw) {
        return new TemporalNormalizationException(ErrorKind.INVALID_DATE, "Invalid event date: " + raw);
    }
}
