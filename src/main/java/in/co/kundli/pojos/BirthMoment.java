package in.co.kundli.pojos;

import in.co.kundli.exceptions.ValidationException;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Civil birth (or event) moment: local date-time, IANA timezone and geographic coordinates.
 *
 * <p>Coordinates are WGS84 decimal degrees: latitude -90..+90 (south negative),
 * longitude -180..+180 (west negative). Immutable; validated at construction.</p>
 */
public final class BirthMoment {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;
    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_LOCATION_LENGTH = 500;

    private final String name;
    private final LocalDateTime dateTime;
    private final double latitude;
    private final double longitude;
    private final String timezone;
    private final String location;

    public BirthMoment(String name, LocalDateTime dateTime, double latitude, double longitude,
                       String timezone, String location) {
        BirthMomentValidation validation = validate(name, dateTime, latitude, longitude, timezone, location);
        if (!validation.isValid()) {
            throw new ValidationException(validation.getErrors());
        }
        this.name = name == null ? "" : name.trim();
        this.dateTime = dateTime;
        this.latitude = latitude;
        this.longitude = longitude;
        this.timezone = timezone.trim();
        this.location = location == null ? "" : location;
    }

    public static BirthMoment of(LocalDateTime dateTime, String timezone, double latitude, double longitude) {
        return new BirthMoment(null, dateTime, latitude, longitude, timezone, null);
    }

    /**
     * Checks every rule without throwing. Name and location are optional.
     */
    public static BirthMomentValidation validate(String name, LocalDateTime dateTime, Double latitude,
                                                 Double longitude, String timezone, String location) {
        List<String> errors = new ArrayList<>();

        if (name != null && name.trim().length() > MAX_NAME_LENGTH) {
            errors.add("Name exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }

        if (dateTime == null) {
            errors.add("Date and time are required");
        } else if (dateTime.getYear() < MIN_YEAR || dateTime.getYear() > MAX_YEAR) {
            errors.add("Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got: " + dateTime.getYear());
        }

        if (latitude == null) {
            errors.add("Latitude is required");
        } else if (!Double.isFinite(latitude)) {
            errors.add("Latitude must be a finite number");
        } else if (latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            errors.add("Latitude must be between " + MIN_LATITUDE + " and " + MAX_LATITUDE + " degrees, got: " + latitude);
        }

        if (longitude == null) {
            errors.add("Longitude is required");
        } else if (!Double.isFinite(longitude)) {
            errors.add("Longitude must be a finite number");
        } else if (longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            errors.add("Longitude must be between " + MIN_LONGITUDE + " and " + MAX_LONGITUDE + " degrees, got: " + longitude);
        }

        if (timezone == null || timezone.isBlank()) {
            errors.add("Timezone must not be blank");
        } else if (!isValidTimezone(timezone.trim())) {
            errors.add("Invalid timezone identifier: " + timezone);
        } else if (dateTime != null && isInDaylightSavingGap(dateTime, ZoneId.of(timezone.trim()))) {
            errors.add(gapMessage(dateTime, timezone.trim()));
        }

        if (location != null && location.length() > MAX_LOCATION_LENGTH) {
            errors.add("Location exceeds maximum length of " + MAX_LOCATION_LENGTH + " characters");
        }

        return BirthMomentValidation.invalid(errors);
    }

    /**
     * Fails fast on coordinates outside the WGS84 ranges above.
     *
     * @throws ValidationException naming the first coordinate that is out of range or not finite
     */
    public static void validateCoordinates(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            throw new ValidationException("Latitude must be between " + MIN_LATITUDE + " and " + MAX_LATITUDE
                    + " degrees, got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            throw new ValidationException("Longitude must be between " + MIN_LONGITUDE + " and " + MAX_LONGITUDE
                    + " degrees, got: " + longitude);
        }
    }

    /**
     * True when the local time was skipped by a forward clock change (e.g. 02:30 on a spring-forward night).
     */
    public static boolean isInDaylightSavingGap(LocalDateTime dateTime, ZoneId zone) {
        return zone.getRules().getValidOffsets(dateTime).isEmpty();
    }

    public static String gapMessage(LocalDateTime dateTime, String timezone) {
        return "Local time " + dateTime + " does not exist in " + timezone + " (daylight saving gap)";
    }

    private static boolean isValidTimezone(String timezone) {
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    public String getName() {
        return name;
    }

    public LocalDateTime getDateTime() {
        return dateTime;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public String getTimezone() {
        return timezone;
    }

    public String getLocation() {
        return location;
    }

    public String getFormattedDateTime() {
        return dateTime.getDayOfMonth() + "/" + dateTime.getMonthValue() + "/" + dateTime.getYear() + " "
                + dateTime.getHour() + ":" + String.format(Locale.ROOT, "%02d", dateTime.getMinute());
    }

    public String getFormattedCoordinates() {
        String latDir = latitude >= 0 ? "N" : "S";
        String lonDir = longitude >= 0 ? "E" : "W";
        return String.format(Locale.ROOT, "%.4f°%s, %.4f°%s", Math.abs(latitude), latDir, Math.abs(longitude), lonDir);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BirthMoment)) return false;
        BirthMoment that = (BirthMoment) o;
        return Double.compare(that.latitude, latitude) == 0
                && Double.compare(that.longitude, longitude) == 0
                && name.equals(that.name)
                && dateTime.equals(that.dateTime)
                && timezone.equals(that.timezone)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dateTime, latitude, longitude, timezone, location);
    }

    @Override
    public String toString() {
        return "BirthMoment{" + dateTime + " " + timezone + ", " + getFormattedCoordinates() + "}";
    }
}
