package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.BirthMoment;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Civil date-time + timezone &lt;-&gt; UTC &lt;-&gt; Julian Day (UT).
 *
 * <p>java.time uses the proleptic Gregorian calendar, so the Julian Day is counted from the Unix epoch
 * (JD 2440587.5) without any Julian-calendar switch. The inverse is rounded to the millisecond, which
 * is well above the ~40 microsecond resolution of a double Julian Day in the supported year range.</p>
 */
public final class TimeConverter {

    public static final double UNIX_EPOCH_JULIAN_DAY = 2440587.5;
    public static final double SECONDS_PER_DAY = 86400.0;

    private TimeConverter() {}

    /**
     * @throws ValidationException for a blank or unknown timezone id
     */
    public static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new ValidationException("Timezone must not be blank");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone identifier: " + timezone, e);
        }
    }

    public static LocalDateTime toUtc(LocalDateTime dateTime, String timezone) {
        return toInstant(dateTime, timezone).atOffset(ZoneOffset.UTC).toLocalDateTime();
    }

    /**
     * Instant of a civil date-time. A local time skipped by a daylight saving change is rejected; a local
     * time that occurs twice (clocks set back) resolves to the earlier of the two offsets.
     *
     * @throws ValidationException for a missing date-time, a year outside the supported range, an unknown
     *                             timezone or a local time inside a daylight saving gap
     */
    public static Instant toInstant(LocalDateTime dateTime, String timezone) {
        if (dateTime == null) {
            throw new ValidationException("Date and time are required");
        }
        validateYear(dateTime.getYear());
        ZoneId zone = zoneOf(timezone);
        if (BirthMoment.isInDaylightSavingGap(dateTime, zone)) {
            throw new ValidationException(BirthMoment.gapMessage(dateTime, timezone.trim()));
        }
        return ZonedDateTime.of(dateTime, zone).toInstant();
    }

    public static double julianDay(Instant instant) {
        long epochDay = Math.floorDiv(instant.getEpochSecond(), 86400L);
        long secondOfDay = Math.floorMod(instant.getEpochSecond(), 86400L);
        double fraction = (secondOfDay + instant.getNano() / 1_000_000_000.0) / SECONDS_PER_DAY;
        return UNIX_EPOCH_JULIAN_DAY + epochDay + fraction;
    }

    /**
     * Julian Day of a UTC civil date-time.
     */
    public static double julianDay(LocalDateTime utcDateTime) {
        return julianDay(utcDateTime.toInstant(ZoneOffset.UTC));
    }

    public static double julianDay(LocalDateTime dateTime, String timezone) {
        return julianDay(toInstant(dateTime, timezone));
    }

    public static double julianDay(BirthMoment moment) {
        return julianDay(moment.getDateTime(), moment.getTimezone());
    }

    public static Instant toInstant(double julianDay) {
        validateJulianDay(julianDay);
        double daysSinceEpoch = julianDay - UNIX_EPOCH_JULIAN_DAY;
        long wholeDays = (long) Math.floor(daysSinceEpoch);
        long millisOfDay = Math.round((daysSinceEpoch - wholeDays) * SECONDS_PER_DAY * 1000.0);
        return Instant.ofEpochSecond(wholeDays * 86400L).plus(millisOfDay, ChronoUnit.MILLIS);
    }

    public static LocalDateTime toUtcDateTime(double julianDay) {
        return LocalDateTime.ofInstant(toInstant(julianDay), ZoneOffset.UTC);
    }

    public static ZonedDateTime toZonedDateTime(double julianDay, String timezone) {
        return toInstant(julianDay).atZone(zoneOf(timezone));
    }

    static void validateJulianDay(double julianDay) {
        if (!Double.isFinite(julianDay)) {
            throw new ValidationException("Julian Day must be a finite number, got: " + julianDay);
        }
    }

    static void validateYear(int year) {
        if (year < BirthMoment.MIN_YEAR || year > BirthMoment.MAX_YEAR) {
            throw new ValidationException("Year must be between " + BirthMoment.MIN_YEAR + " and "
                    + BirthMoment.MAX_YEAR + ", got: " + year);
        }
    }
}
