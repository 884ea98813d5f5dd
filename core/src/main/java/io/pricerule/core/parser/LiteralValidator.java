package io.pricerule.core.parser;

import io.pricerule.core.error.InvalidLiteralException;
import io.pricerule.core.model.ValueType;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation and normalisation of the arguments of {@code date(...)}, {@code time(...)} and
 * {@code datetime(...)} literals.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class LiteralValidator {

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");

    /** Rejects 2023-02-29 and friends instead of rolling them over. */
    private static final DateTimeFormatter STRICT_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private LiteralValidator() {}

    /**
     * Checks that {@code value} is a real calendar date in {@code YYYY-MM-DD} form.
     *
     * @return {@code value}, unchanged
     * @throws InvalidLiteralException if the format or the date is invalid
     */
    public static String validateDate(String value) {
        if (!DATE_PATTERN.matcher(value).matches()) {
            throw new InvalidLiteralException(
                    "Invalid date literal \"" + value + "\". Expected YYYY-MM-DD.", ValueType.DATE);
        }
        try {
            LocalDate.parse(value, STRICT_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidLiteralException("Invalid date literal \"" + value + "\".", e, ValueType.DATE);
        }
        return value;
    }

    /**
     * Validates a clock time and normalises it to zero-padded 24-hour {@code HH:MM[:SS]}.
     *
     * <p>
     * With a meridiem the hour must be 1 to 12: {@code 12 AM} becomes {@code 00} and
     * {@code 12 PM} stays {@code 12}. Without one the hour must be 0 to 23.
     *
     * @param value    {@code H:MM}, {@code HH:MM} or {@code HH:MM:SS}
     * @param meridiem {@code AM} or {@code PM} in any case, or {@code null}
     * @return the normalised time
     * @throws InvalidLiteralException if any part is out of range
     */
    public static String normalizeTime(String value, String meridiem) {
        String trimmed = value.trim();
        var matcher = TIME_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidLiteralException(
                    "Invalid time literal \"" + value + "\". Expected HH:MM or HH:MM:SS.", ValueType.TIME);
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        Integer seconds = matcher.group(3) != null ? Integer.valueOf(matcher.group(3)) : null;

        if (minutes > 59 || (seconds != null && seconds > 59)) {
            throw new InvalidLiteralException("Invalid time literal \"" + value + "\".", ValueType.TIME);
        }

        if (meridiem != null) {
            String normalizedMeridiem = meridiem.trim().toUpperCase(Locale.ROOT);
            if (!normalizedMeridiem.equals("AM") && !normalizedMeridiem.equals("PM")) {
                throw new InvalidLiteralException(
                        "Invalid meridiem \"" + meridiem + "\" in time literal.", ValueType.TIME);
            }
            if (hours < 1 || hours > 12) {
                throw new InvalidLiteralException(
                        "Invalid time literal \"" + value + "\" for 12-hour clock.", ValueType.TIME);
            }
            if (hours == 12) {
                hours = normalizedMeridiem.equals("AM") ? 0 : 12;
            } else if (normalizedMeridiem.equals("PM")) {
                hours += 12;
            }
        } else if (hours > 23) {
            throw new InvalidLiteralException("Invalid time literal \"" + value + "\".", ValueType.TIME);
        }

        String normalized = String.format("%02d:%02d", hours, minutes);
        return seconds != null ? normalized + String.format(":%02d", seconds) : normalized;
    }

    /**
     * Checks that {@code value} is an ISO-8601 date-time, with or without offset or zone, or a
     * plain ISO date.
     *
     * @return {@code value}, unchanged
     * @throws InvalidLiteralException if it does not parse
     */
    public static String validateDatetime(String value) {
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(value);
            return value;
        } catch (DateTimeParseException dateTimeFailure) {
            try {
                DateTimeFormatter.ISO_DATE.parse(value);
                return value;
            } catch (DateTimeParseException e) {
                throw new InvalidLiteralException(
                        "Invalid datetime literal \"" + value + "\".", dateTimeFailure, ValueType.DATETIME);
            }
        }
    }
}
