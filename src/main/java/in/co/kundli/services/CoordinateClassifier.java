package in.co.kundli.services;

import in.co.kundli.pojos.BodyPosition;
import in.co.kundli.pojos.Nakshatra;
import in.co.kundli.pojos.RawPosition;
import in.co.kundli.pojos.ZodiacSign;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Longitude → sign, degree/minute/second inside the sign, nakshatra and pada.
 *
 * <h2>Boundary handling</h2>
 * Nakshatra and pada spans (13°20', 3°20') are not representable in binary floating point, so
 * {@code lon / span} computed with doubles can land just below a whole number for a longitude
 * that sits exactly on a boundary, putting it in the preceding mansion. Those quotients are
 * computed in {@link BigDecimal} (34 significant digits) from the shortest decimal form of the
 * double, and a quotient within {@link EngineConfig#BOUNDARY_SNAP_TOLERANCE} of a whole number is
 * snapped onto it. A value on a boundary therefore always belongs to the division that begins there.
 *
 * <p>All methods are static and pure: identical input gives bit-identical output.</p>
 */
public final class CoordinateClassifier {

    private static final MathContext PRECISION = MathContext.DECIMAL128;
    private static final BigDecimal CIRCLE = BigDecimal.valueOf(360);
    private static final BigDecimal NAKSHATRA_SPAN = CIRCLE.divide(BigDecimal.valueOf(Nakshatra.COUNT), PRECISION);
    private static final BigDecimal PADA_SPAN = NAKSHATRA_SPAN.divide(BigDecimal.valueOf(4), PRECISION);
    private static final BigDecimal SNAP_TOLERANCE = BigDecimal.valueOf(EngineConfig.BOUNDARY_SNAP_TOLERANCE);

    private CoordinateClassifier() {}

    /**
     * Result of classifying one longitude.
     */
    public static final class Classification {
        public final double longitude;
        public final ZodiacSign sign;
        public final int degree;
        public final int minute;
        public final double second;
        public final Nakshatra nakshatra;
        public final int pada;

        Classification(double longitude, ZodiacSign sign, int degree, int minute, double second,
                       Nakshatra nakshatra, int pada) {
            this.longitude = longitude;
            this.sign = sign;
            this.degree = degree;
            this.minute = minute;
            this.second = second;
            this.nakshatra = nakshatra;
            this.pada = pada;
        }
    }

    /**
     * Result of the nakshatra lookup alone.
     */
    public static final class NakshatraPosition {
        public final Nakshatra nakshatra;
        public final int pada;

        NakshatraPosition(Nakshatra nakshatra, int pada) {
            this.nakshatra = nakshatra;
            this.pada = pada;
        }
    }

    /**
     * Normalizes any finite longitude to [0, 360).
     */
    public static double normalize(double longitude) {
        double result = ((longitude % EngineConfig.DEGREES_PER_CIRCLE) + EngineConfig.DEGREES_PER_CIRCLE)
                % EngineConfig.DEGREES_PER_CIRCLE;
        return result >= EngineConfig.DEGREES_PER_CIRCLE ? 0.0 : result;
    }

    /**
     * Shortest-arc distance between two longitudes, in [0, 180].
     */
    public static double angularDistance(double a, double b) {
        double diff = Math.abs(normalize(a) - normalize(b));
        return diff > 180.0 ? EngineConfig.DEGREES_PER_CIRCLE - diff : diff;
    }

    public static int signIndex(double longitude) {
        return Math.min(11, (int) Math.floor(normalize(longitude) / EngineConfig.DEGREES_PER_SIGN));
    }

    public static ZodiacSign sign(double longitude) {
        return ZodiacSign.fromIndex(signIndex(longitude));
    }

    /**
     * Degrees elapsed inside the sign, in [0, 30).
     */
    public static double degreeInSign(double longitude) {
        double normalized = normalize(longitude);
        double inSign = normalized - signIndex(normalized) * EngineConfig.DEGREES_PER_SIGN;
        return inSign < 0.0 ? 0.0 : inSign;
    }

    public static Classification classify(double longitude) {
        requireFinite(longitude);
        double normalized = normalize(longitude);
        int signIndex = signIndex(normalized);
        double inSign = degreeInSign(normalized);

        int wholeDegrees = (int) inSign;
        double totalMinutes = (inSign - wholeDegrees) * EngineConfig.MINUTES_PER_DEGREE;
        int wholeMinutes = (int) totalMinutes;
        double seconds = (totalMinutes - wholeMinutes) * EngineConfig.SECONDS_PER_MINUTE;

        NakshatraPosition np = nakshatra(normalized);
        return new Classification(normalized, ZodiacSign.fromIndex(signIndex), wholeDegrees, wholeMinutes,
                seconds, np.nakshatra, np.pada);
    }

    public static NakshatraPosition nakshatra(double longitude) {
        requireFinite(longitude);
        BigDecimal lon = new BigDecimal(Double.toString(longitude)).remainder(CIRCLE, PRECISION);
        if (lon.signum() < 0) {
            lon = lon.add(CIRCLE);
        }

        int index = clamp(boundarySafeFloor(lon.divide(NAKSHATRA_SPAN, PRECISION)), 0, Nakshatra.COUNT - 1);

        BigDecimal positionInNakshatra = lon.subtract(NAKSHATRA_SPAN.multiply(BigDecimal.valueOf(index), PRECISION));
        if (positionInNakshatra.signum() < 0) {
            positionInNakshatra = BigDecimal.ZERO;
        }
        int pada = clamp(boundarySafeFloor(positionInNakshatra.divide(PADA_SPAN, PRECISION)) + 1, 1, 4);

        return new NakshatraPosition(Nakshatra.fromIndex(index), pada);
    }

    /**
     * Navamsa sign read from the pada the longitude falls in.
     */
    public static ZodiacSign navamsaSign(double longitude) {
        NakshatraPosition np = nakshatra(longitude);
        return np.nakshatra.getPadaNavamsaSign(np.pada);
    }

    /**
     * Builds a fully classified position from provider output and an already determined house.
     */
    public static BodyPosition toBodyPosition(RawPosition raw, int house) {
        Classification c = classify(raw.longitude);
        return new BodyPosition(raw.planet, c.longitude, raw.latitude, raw.distance, raw.speed,
                c.sign, c.degree, c.minute, c.second, c.nakshatra, c.pada, house);
    }

    /**
     * {@code floor(numerator / denominator)} computed in decimal, snapping onto a whole number
     * when the quotient is within the tolerance of it.
     */
    public static int boundarySafeFloor(double numerator, double denominator) {
        BigDecimal quotient = new BigDecimal(Double.toString(numerator))
                .divide(new BigDecimal(Double.toString(denominator)), PRECISION);
        return boundarySafeFloor(quotient);
    }

    static int boundarySafeFloor(BigDecimal quotient) {
        BigDecimal nearest = quotient.setScale(0, RoundingMode.HALF_UP);
        if (quotient.subtract(nearest).abs().compareTo(SNAP_TOLERANCE) < 0) {
            return nearest.intValue();
        }
        return quotient.setScale(0, RoundingMode.FLOOR).intValue();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static void requireFinite(double longitude) {
        if (!Double.isFinite(longitude)) {
            throw new IllegalArgumentException("Longitude must be a finite number, got: " + longitude);
        }
    }
}
