package com.wbem.cimobj.types;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A CIM datetime value: either a point in time with a UTC offset in minutes, or an
 * interval.
 *
 * <p>The string form has 25 characters:
 * <ul>
 *   <li>point in time: {@code yyyymmddhhmmss.mmmmmm(+|-)ooo}, {@code ooo} being the UTC
 *       offset in minutes</li>
 *   <li>interval: {@code ddddddddhhmmss.mmmmmm:000}</li>
 * </ul>
 * Trailing digits up to the microseconds may be replaced by asterisks to express a
 * reduced precision; the precision is kept and rendered back by {@link #toString()}.
 *
 * <p>Equality compares the denoted instant or duration; the UTC offset and the precision
 * do not take part in it.
 */
public final class CIMDateTime {

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile(
        "^([0-9*]{4})([0-9*]{2})([0-9*]{2})([0-9*]{2})([0-9*]{2})([0-9*]{2})\\.([0-9*]{6})([+-])([0-9]{3})$");

    private static final Pattern INTERVAL_PATTERN = Pattern.compile(
        "^([0-9*]{8})([0-9*]{2})([0-9*]{2})([0-9*]{2})\\.([0-9*]{6}):(000)$");

    private static final int LENGTH = 25;
    private static final int DOT_INDEX = 14;
    private static final int SIGN_INDEX = 21;
    private static final long MAX_INTERVAL_DAYS = 99_999_999L;

    private final OffsetDateTime datetime;
    private final Duration timedelta;
    private final Integer precision;

    private CIMDateTime(OffsetDateTime datetime, Duration timedelta, Integer precision) {
        this.datetime = datetime;
        this.timedelta = timedelta;
        this.precision = precision;
    }

    public CIMDateTime(String value) {
        CIMDateTime parsed = parse(value);
        this.datetime = parsed.datetime;
        this.timedelta = parsed.timedelta;
        this.precision = parsed.precision;
    }

    public CIMDateTime(OffsetDateTime value) {
        this(checkYear(value.truncatedTo(ChronoUnit.MICROS)), null, null);
    }

    public CIMDateTime(ZonedDateTime value) {
        this(value.toOffsetDateTime());
    }

    /**
     * A date and time without zone information is taken to be in UTC.
     */
    public CIMDateTime(LocalDateTime value) {
        this(value.atOffset(ZoneOffset.UTC));
    }

    public CIMDateTime(Duration value) {
        this(null, checkInterval(value.truncatedTo(ChronoUnit.MICROS)), null);
    }

    public CIMDateTime(CIMDateTime other) {
        this(other.datetime, other.timedelta, other.precision);
    }

    /**
     * Convert any accepted datetime input to a {@code CIMDateTime}.
     *
     * @throws CIMTypeException for values of other classes
     * @throws CIMValueException for malformed strings
     */
    public static CIMDateTime of(Object value) {
        if (value instanceof CIMDateTime dt) {
            return dt;
        }
        if (value instanceof String s) {
            return new CIMDateTime(s);
        }
        if (value instanceof OffsetDateTime odt) {
            return new CIMDateTime(odt);
        }
        if (value instanceof ZonedDateTime zdt) {
            return new CIMDateTime(zdt);
        }
        if (value instanceof LocalDateTime ldt) {
            return new CIMDateTime(ldt);
        }
        if (value instanceof Duration d) {
            return new CIMDateTime(d);
        }
        throw new CIMTypeException("A value of type " + (value == null ? "null" : value.getClass().getName())
            + " cannot be converted to a CIM datetime value");
    }

    /**
     * The current point in time, with the local UTC offset.
     */
    public static CIMDateTime now() {
        return new CIMDateTime(OffsetDateTime.now());
    }

    /**
     * The current point in time, with the given UTC offset.
     */
    public static CIMDateTime now(int minutesFromUtc) {
        return new CIMDateTime(OffsetDateTime.now(offset(minutesFromUtc)));
    }

    /**
     * The point in time of a POSIX timestamp.
     *
     * @param epochSecond seconds since 1970-01-01T00:00:00Z
     * @param minutesFromUtc UTC offset to use, or {@code null} for the local offset
     */
    public static CIMDateTime fromTimestamp(long epochSecond, Integer minutesFromUtc) {
        Instant instant = Instant.ofEpochSecond(epochSecond);
        ZoneOffset zoneOffset = minutesFromUtc == null
            ? ZoneId.systemDefault().getRules().getOffset(instant)
            : offset(minutesFromUtc);
        return new CIMDateTime(OffsetDateTime.ofInstant(instant, zoneOffset));
    }

    private static ZoneOffset offset(int minutesFromUtc) {
        try {
            return ZoneOffset.ofTotalSeconds(minutesFromUtc * 60);
        } catch (DateTimeException e) {
            throw new CIMValueException("Invalid UTC offset in minutes: " + minutesFromUtc, e);
        }
    }

    private static OffsetDateTime checkYear(OffsetDateTime value) {
        if (value.getYear() < 1 || value.getYear() > 9999) {
            throw new CIMValueException("Year of a CIM datetime value must be between 1 and 9999, but is "
                + value.getYear());
        }
        return value;
    }

    private static Duration checkInterval(Duration value) {
        if (value.isNegative()) {
            throw new CIMValueException("A CIM datetime interval cannot be negative: " + value);
        }
        if (value.toDays() > MAX_INTERVAL_DAYS) {
            throw new CIMValueException("A CIM datetime interval cannot exceed " + MAX_INTERVAL_DAYS
                + " days: " + value);
        }
        return value;
    }

    private static CIMDateTime parse(String value) {
        if (value == null) {
            throw new CIMValueException("CIM datetime string must not be null");
        }
        if (value.length() != LENGTH) {
            throw new CIMValueException("Invalid CIM datetime string (must have " + LENGTH
                + " characters): '" + value + "'");
        }
        Integer precision = parsePrecision(value);
        char separator = value.charAt(SIGN_INDEX);
        if (separator == ':') {
            return parseInterval(value, precision);
        }
        if (separator == '+' || separator == '-') {
            return parseTimestamp(value, precision);
        }
        throw new CIMValueException("Invalid CIM datetime string: '" + value + "'");
    }

    private static Integer parsePrecision(String value) {
        int first = value.indexOf('*');
        if (first < 0) {
            return null;
        }
        for (int i = first; i < SIGN_INDEX; i++) {
            char c = value.charAt(i);
            if (c != '*' && i != DOT_INDEX) {
                throw new CIMValueException("Asterisks in CIM datetime string must be contiguous and end "
                    + "with the microseconds: '" + value + "'");
            }
        }
        if (value.indexOf('*', SIGN_INDEX) >= 0) {
            throw new CIMValueException("Invalid asterisk in the UTC offset of CIM datetime string: '"
                + value + "'");
        }
        return first;
    }

    private static CIMDateTime parseTimestamp(String value, Integer precision) {
        Matcher m = TIMESTAMP_PATTERN.matcher(value);
        if (!m.matches()) {
            throw new CIMValueException("Invalid CIM datetime timestamp string: '" + value + "'");
        }
        int year = field(m.group(1), 1);
        int month = field(m.group(2), 1);
        int day = field(m.group(3), 1);
        int hour = field(m.group(4), 0);
        int minute = field(m.group(5), 0);
        int second = field(m.group(6), 0);
        int micros = field(m.group(7), 0);
        int offsetMinutes = Integer.parseInt(m.group(9));
        if ("-".equals(m.group(8))) {
            offsetMinutes = -offsetMinutes;
        }
        try {
            LocalDateTime local = LocalDateTime.of(year, month, day, hour, minute, second, micros * 1000);
            OffsetDateTime datetime = local.atOffset(offset(offsetMinutes));
            return new CIMDateTime(checkYear(datetime), null, precision);
        } catch (DateTimeException e) {
            throw new CIMValueException("Invalid field value in CIM datetime string '" + value + "': "
                + e.getMessage(), e);
        }
    }

    private static CIMDateTime parseInterval(String value, Integer precision) {
        Matcher m = INTERVAL_PATTERN.matcher(value);
        if (!m.matches()) {
            throw new CIMValueException("Invalid CIM datetime interval string: '" + value + "'");
        }
        long days = field(m.group(1), 0);
        int hours = field(m.group(2), 0);
        int minutes = field(m.group(3), 0);
        int seconds = field(m.group(4), 0);
        int micros = field(m.group(5), 0);
        if (hours > 23 || minutes > 59 || seconds > 59) {
            throw new CIMValueException("Invalid field value in CIM datetime interval string: '" + value + "'");
        }
        Duration timedelta = Duration.ofDays(days)
            .plusHours(hours)
            .plusMinutes(minutes)
            .plusSeconds(seconds)
            .plusNanos(micros * 1000L);
        return new CIMDateTime(null, timedelta, precision);
    }

    // Fields with asterisks count from their lowest valid value.
    private static int field(String digits, int minimum) {
        int parsed = Integer.parseInt(digits.replace('*', '0'));
        return Math.max(parsed, minimum);
    }

    public boolean isInterval() {
        return timedelta != null;
    }

    /**
     * The point in time, or {@code null} for an interval.
     */
    public OffsetDateTime getDatetime() {
        return datetime;
    }

    /**
     * The interval, or {@code null} for a point in time.
     */
    public Duration getTimedelta() {
        return timedelta;
    }

    /**
     * Index of the first asterisk in the string form, or {@code null} for full precision.
     */
    public Integer getPrecision() {
        return precision;
    }

    /**
     * UTC offset of a point in time in minutes, or {@code null} for an interval.
     */
    public Integer getMinutesFromUtc() {
        if (datetime == null) {
            return null;
        }
        return datetime.getOffset().getTotalSeconds() / 60;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMDateTime other)) {
            return false;
        }
        if (datetime != null) {
            return other.datetime != null && datetime.isEqual(other.datetime);
        }
        return other.timedelta != null && timedelta.equals(other.timedelta);
    }

    @Override
    public int hashCode() {
        return datetime != null ? datetime.toInstant().hashCode() : timedelta.hashCode();
    }

    /**
     * The 25-character CIM datetime string.
     */
    @Override
    public String toString() {
        String text;
        if (datetime != null) {
            int offsetMinutes = getMinutesFromUtc();
            text = String.format("%04d%02d%02d%02d%02d%02d.%06d%s%03d",
                datetime.getYear(), datetime.getMonthValue(), datetime.getDayOfMonth(),
                datetime.getHour(), datetime.getMinute(), datetime.getSecond(),
                datetime.getNano() / 1000,
                offsetMinutes >= 0 ? "+" : "-", Math.abs(offsetMinutes));
        } else {
            long totalSeconds = timedelta.getSeconds();
            text = String.format("%08d%02d%02d%02d.%06d:000",
                totalSeconds / 86_400, (totalSeconds / 3600) % 24, (totalSeconds / 60) % 60,
                totalSeconds % 60, timedelta.getNano() / 1000);
        }
        if (precision == null) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text);
        for (int i = precision; i < SIGN_INDEX; i++) {
            if (i != DOT_INDEX) {
                sb.setCharAt(i, '*');
            }
        }
        return sb.toString();
    }
}
