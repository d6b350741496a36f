package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.ChartCusps;
import in.co.kundli.pojos.HouseSystem;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * House cusps for a moment and place, and the mapping from a longitude to the house that contains it.
 *
 * <p>A house runs from its own cusp up to (but not including) the next house's cusp, wrapping past 360°.
 * Widths below {@link EngineConfig#DEGENERATE_HOUSE_WIDTH}, which some quadrant systems produce near the
 * poles, are treated as a full 30°. When rounding leaves a longitude unclaimed the house with the closest
 * cusp is used and a {@code house_fallback_used} warning is logged.</p>
 */
public class HouseSystemCalculator {

    private static final AtomicLong fallbackCount = new AtomicLong();

    private final EphemerisAccessor accessor;

    public HouseSystemCalculator(EphemerisAccessor accessor) {
        this.accessor = accessor;
    }

    /**
     * House placement of one longitude.
     */
    public static final class HousePlacement {
        private final int house;
        private final boolean fallback;

        HousePlacement(int house, boolean fallback) {
            this.house = house;
            this.fallback = fallback;
        }

        public int getHouse() {
            return house;
        }

        /**
         * @return true if no house range contained the longitude and the closest cusp was used
         */
        public boolean isFallback() {
            return fallback;
        }
    }

    public ChartCusps cusps(double julianDay, double latitude, double longitude, char houseSystemCode) {
        HouseSystem houseSystem = HouseSystem.fromCode(houseSystemCode);
        if (houseSystem == null) {
            throw new ValidationException("Unsupported house system code: " + houseSystemCode);
        }
        return cusps(julianDay, latitude, longitude, houseSystem);
    }

    public ChartCusps cusps(double julianDay, double latitude, double longitude, HouseSystem houseSystem) {
        BirthMoment.validateCoordinates(latitude, longitude);
        TimeConverter.validateJulianDay(julianDay);
        HouseSystem system = houseSystem == null ? EngineConfig.DEFAULT_HOUSE_SYSTEM : houseSystem;
        return accessor.calculateExclusively(session -> session.houses(julianDay, latitude, longitude, system));
    }

    public static int houseOf(double longitude, ChartCusps cusps) {
        return placement(longitude, cusps.toArray()).getHouse();
    }

    /**
     * @param cusps twelve cusp longitudes, house 1 first
     */
    public static int houseOf(double longitude, double[] cusps) {
        return placement(longitude, cusps).getHouse();
    }

    public static HousePlacement placement(double longitude, ChartCusps cusps) {
        return placement(longitude, cusps.toArray());
    }

    public static HousePlacement placement(double longitude, double[] cusps) {
        if (cusps == null || cusps.length != 12) {
            throw new IllegalArgumentException("Exactly 12 house cusps are required");
        }
        double normalizedLon = CoordinateClassifier.normalize(longitude);

        for (int i = 0; i < 12; i++) {
            double start = CoordinateClassifier.normalize(cusps[i]);
            double end = CoordinateClassifier.normalize(cusps[(i + 1) % 12]);

            double width = CoordinateClassifier.normalize(end - start);
            if (width < EngineConfig.DEGENERATE_HOUSE_WIDTH) {
                width = EngineConfig.DEGREES_PER_SIGN;
            }

            double offset = CoordinateClassifier.normalize(normalizedLon - start);
            if (offset < width) {
                return new HousePlacement(i + 1, false);
            }
        }

        int closestHouse = 1;
        double minDistance = Double.MAX_VALUE;
        for (int i = 0; i < 12; i++) {
            double distance = CoordinateClassifier.angularDistance(normalizedLon, cusps[i]);
            if (distance < minDistance) {
                minDistance = distance;
                closestHouse = i + 1;
            }
        }

        fallbackCount.incrementAndGet();
        LoggingService.warn("house_fallback_used", Map.of(
                "longitude", normalizedLon,
                "house", closestHouse,
                "cuspDistance", minDistance));
        return new HousePlacement(closestHouse, true);
    }

    /**
     * Number of closest-cusp fallbacks taken since the class was loaded.
     */
    public static long getFallbackCount() {
        return fallbackCount.get();
    }

    /**
     * Whole-sign house of {@code signIndex} counted from the ascendant's sign.
     */
    public static int wholeSignHouse(int signIndex, int ascendantSignIndex) {
        return Math.floorMod(signIndex - ascendantSignIndex, 12) + 1;
    }
}
