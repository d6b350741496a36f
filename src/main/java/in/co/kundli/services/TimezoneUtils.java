package in.co.kundli.services;

import in.co.kundli.pojos.BirthMoment;
import net.iakovlev.timeshape.TimeZoneEngine;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * Timezone lookup from coordinates, for callers that know where a birth happened but not its zone id.
 * Backed by Timeshape boundary data; falls back to a longitude/15 offset rounded to the half hour.
 */
public class TimezoneUtils {

    // Loading the boundary data is expensive, so one engine is shared
    private static volatile TimeZoneEngine timeZoneEngine;
    private static final Object lock = new Object();

    private TimezoneUtils() {}

    private static TimeZoneEngine getTimeZoneEngine() {
        if (timeZoneEngine == null) {
            synchronized (lock) {
                if (timeZoneEngine == null) {
                    try {
                        timeZoneEngine = TimeZoneEngine.initialize(true);
                    } catch (RuntimeException e) {
                        LoggingService.warn("timezone_engine_init_failed", Map.of("error", String.valueOf(e.getMessage())));
                        timeZoneEngine = TimeZoneEngine.initialize(false);
                    }
                }
            }
        }
        return timeZoneEngine;
    }

    /**
     * IANA zone for the coordinates, if the boundary data has one (open sea has none).
     */
    public static Optional<ZoneId> getZoneId(double latitude, double longitude) {
        BirthMoment.validateCoordinates(latitude, longitude);
        try {
            return getTimeZoneEngine().query(latitude, longitude);
        } catch (RuntimeException e) {
            LoggingService.error("timezone_get_zoneid_error", e);
            return Optional.empty();
        }
    }

    /**
     * Zone id usable with {@link TimeConverter}: the IANA id where known (e.g. "Asia/Kolkata"),
     * otherwise a fixed offset id such as "+05:30".
     */
    public static String getTimezoneId(double latitude, double longitude) {
        Optional<ZoneId> zoneId = getZoneId(latitude, longitude);
        if (zoneId.isPresent()) {
            return zoneId.get().getId();
        }
        String fallback = getFallbackZoneOffset(longitude).getId();
        LoggingService.info("timezone_fallback_used", Map.of(
                "latitude", latitude,
                "longitude", longitude,
                "zone", fallback));
        return fallback;
    }

    /**
     * UTC offset in hours at the given local date and time, honouring historical rules of the zone.
     */
    public static double getTimezoneOffset(double latitude, double longitude, LocalDateTime localDateTime) {
        ZoneId zone = ZoneId.of(getTimezoneId(latitude, longitude));
        ZoneOffset offset = zone.getRules().getOffset(localDateTime);
        return offset.getTotalSeconds() / 3600.0;
    }

    /**
     * Each 15° of longitude is one hour, rounded to the nearest half hour.
     */
    static double getFallbackTimezoneOffset(double longitude) {
        double timezoneOffset = longitude / 15.0;
        return Math.round(timezoneOffset * 2.0) / 2.0;
    }

    static ZoneOffset getFallbackZoneOffset(double longitude) {
        double offset = getFallbackTimezoneOffset(longitude);
        int hours = (int) offset;
        int minutes = (int) ((offset - hours) * 60);
        return ZoneOffset.ofHoursMinutes(hours, minutes);
    }
}
