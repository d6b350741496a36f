package in.co.kundli.provider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-memory provider for tests. Every body moves linearly from a fixed J2000 longitude,
 * the ayanamsa drifts at the precession rate, and cusps are derived from a sidereal-time angle.
 *
 * <p>Records overlapping calls: two position/house calls at the same time, or an ayanamsa call during one,
 * count as a violation of the accessor's locking.</p>
 */
public class FakeEphemerisProvider implements EphemerisProvider {

    public static final double J2000 = 2451545.0;

    // tropical longitude at J2000 and mean daily motion, indexed by provider body id
    private static final double[] BASE_LONGITUDE = {
            280.46, 218.32, 252.25, 181.98, 355.43, 34.35, 50.08, 314.05, 304.35, 238.93, 125.04, 125.04
    };
    private static final double[] DAILY_MOTION = {
            0.98565, 13.17640, 4.09234, 1.60213, 0.52403, 0.08309, 0.03346, 0.01173, 0.00598, 0.00397, -0.05295, -0.05295
    };

    private static final double AYANAMSA_AT_J2000 = 23.853;
    private static final double AYANAMSA_PER_DAY = 50.29 / 3600.0 / 365.25;
    private static final double SIDEREAL_DEGREES_PER_DAY = 360.98564736629;

    private final AtomicInteger exclusiveInFlight = new AtomicInteger();
    private final AtomicInteger readersInFlight = new AtomicInteger();
    private final AtomicInteger violations = new AtomicInteger();
    private final AtomicInteger calculateCalls = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    private volatile String ephemerisPath;
    private volatile int siderealMode = -1;
    private volatile int failingBodyId = -1;
    private volatile String failureMessage = "";
    private volatile int houseErrorCode = ProviderConstants.OK;
    private volatile int lastFlags;

    public void failFor(int bodyId, String message) {
        this.failingBodyId = bodyId;
        this.failureMessage = message;
    }

    public void failHousesWith(int code) {
        this.houseErrorCode = code;
    }

    public int getViolations() {
        return violations.get();
    }

    public int getCalculateCalls() {
        return calculateCalls.get();
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    public String getEphemerisPath() {
        return ephemerisPath;
    }

    public int getSiderealMode() {
        return siderealMode;
    }

    public int getLastFlags() {
        return lastFlags;
    }

    @Override
    public void setEphemerisPath(String path) {
        this.ephemerisPath = path;
    }

    @Override
    public void setSiderealMode(int mode) {
        this.siderealMode = mode;
    }

    @Override
    public int calculate(double julianDay, int bodyId, int flags, double[] result, StringBuilder error) {
        enterExclusive();
        try {
            calculateCalls.incrementAndGet();
            lastFlags = flags;
            if (bodyId == failingBodyId) {
                error.append(failureMessage);
                return ProviderConstants.ERR;
            }
            result[0] = longitudeOf(bodyId, julianDay);
            result[1] = bodyId == ProviderConstants.MOON ? 5.1 : 0.0;
            result[2] = 1.0 + bodyId * 0.5;
            result[3] = DAILY_MOTION[bodyId];
            return ProviderConstants.OK;
        } finally {
            exclusiveInFlight.decrementAndGet();
        }
    }

    @Override
    public double ayanamsa(double julianDay) {
        readersInFlight.incrementAndGet();
        try {
            if (exclusiveInFlight.get() > 0) {
                violations.incrementAndGet();
            }
            Thread.yield();
            return rawAyanamsa(julianDay);
        } finally {
            readersInFlight.decrementAndGet();
        }
    }

    @Override
    public int houses(double julianDay, int flags, double latitude, double longitude, int houseSystem,
                      double[] cusps, double[] ascMc) {
        enterExclusive();
        try {
            double ascendant = normalize(100.0 + SIDEREAL_DEGREES_PER_DAY * (julianDay - J2000) + longitude
                    - rawAyanamsa(julianDay));
            // unequal quadrant-like widths that still add up to 360
            double skew = houseSystem == 'E' || houseSystem == 'W' ? 0.0 : Math.abs(latitude) / 9.0;
            double cusp = ascendant;
            for (int house = 1; house <= 12; house++) {
                cusps[house] = normalize(cusp);
                cusp += house % 2 == 1 ? 30.0 + skew : 30.0 - skew;
            }
            ascMc[ProviderConstants.ASC_INDEX] = ascendant;
            ascMc[ProviderConstants.MC_INDEX] = normalize(ascendant + 270.0);
            return houseErrorCode;
        } finally {
            exclusiveInFlight.decrementAndGet();
        }
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    /**
     * Sidereal longitude this provider reports for a body.
     */
    public static double longitudeOf(int bodyId, double julianDay) {
        return normalize(BASE_LONGITUDE[bodyId] + DAILY_MOTION[bodyId] * (julianDay - J2000) - rawAyanamsa(julianDay));
    }

    public static double speedOf(int bodyId) {
        return DAILY_MOTION[bodyId];
    }

    public static double rawAyanamsa(double julianDay) {
        return AYANAMSA_AT_J2000 + AYANAMSA_PER_DAY * (julianDay - J2000);
    }

    private void enterExclusive() {
        if (exclusiveInFlight.incrementAndGet() > 1 || readersInFlight.get() > 0) {
            violations.incrementAndGet();
        }
        Thread.yield();
    }

    private static double normalize(double degrees) {
        double result = degrees % 360.0;
        return result < 0 ? result + 360.0 : result;
    }
}
