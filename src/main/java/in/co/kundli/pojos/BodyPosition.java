package in.co.kundli.pojos;

import java.util.Locale;
import java.util.Objects;

/**
 * Fully classified position of one body in a chart.
 *
 * <p>Immutable. {@code longitude} is sidereal and normalized to [0, 360); {@code degree},
 * {@code minute} and {@code second} are measured inside {@code sign}; {@code house} is 1-12.</p>
 */
public final class BodyPosition {

    private final Planet planet;
    private final double longitude;
    private final double latitude;
    private final double distance;
    private final double speed;
    private final ZodiacSign sign;
    private final int degree;
    private final int minute;
    private final double second;
    private final Nakshatra nakshatra;
    private final int pada;
    private final int house;

    public BodyPosition(Planet planet, double longitude, double latitude, double distance, double speed,
                        ZodiacSign sign, int degree, int minute, double second,
                        Nakshatra nakshatra, int pada, int house) {
        this.planet = planet;
        this.longitude = longitude;
        this.latitude = latitude;
        this.distance = distance;
        this.speed = speed;
        this.sign = sign;
        this.degree = degree;
        this.minute = minute;
        this.second = second;
        this.nakshatra = nakshatra;
        this.pada = pada;
        this.house = house;
    }

    public Planet getPlanet() {
        return planet;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getDistance() {
        return distance;
    }

    public double getSpeed() {
        return speed;
    }

    public boolean isRetrograde() {
        return speed < 0.0;
    }

    public ZodiacSign getSign() {
        return sign;
    }

    public int getDegree() {
        return degree;
    }

    public int getMinute() {
        return minute;
    }

    public double getSecond() {
        return second;
    }

    public double getDegreeInSign() {
        return longitude - sign.getIndex() * 30.0;
    }

    public Nakshatra getNakshatra() {
        return nakshatra;
    }

    public int getPada() {
        return pada;
    }

    public int getHouse() {
        return house;
    }

    public String getFormattedDegreeInSign() {
        return String.format(Locale.ROOT, "%d° %d' %d\"", degree, minute, (int) second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BodyPosition)) return false;
        BodyPosition that = (BodyPosition) o;
        return Double.compare(that.longitude, longitude) == 0
                && Double.compare(that.latitude, latitude) == 0
                && Double.compare(that.distance, distance) == 0
                && Double.compare(that.speed, speed) == 0
                && degree == that.degree
                && minute == that.minute
                && Double.compare(that.second, second) == 0
                && pada == that.pada
                && house == that.house
                && planet == that.planet
                && sign == that.sign
                && nakshatra == that.nakshatra;
    }

    @Override
    public int hashCode() {
        return Objects.hash(planet, longitude, latitude, distance, speed, sign, degree, minute, second,
                nakshatra, pada, house);
    }

    @Override
    public String toString() {
        return planet.getDisplayName() + " " + sign.getDisplayName() + " " + getFormattedDegreeInSign()
                + (isRetrograde() ? " [R]" : "") + " " + nakshatra.getDisplayName() + "-" + pada + " H" + house;
    }
}
