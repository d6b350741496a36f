package in.co.kundli.services;

import in.co.kundli.pojos.DivisionalChartType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The thirteen varga rules.
 *
 * <p>Every chart except D30 cuts the sign into N equal parts and sends part {@code p} of sign {@code s}
 * to a destination sign given by a {@link DestinationRule}; the offset inside the part is stretched to
 * fill the whole 30° of the destination. Part boundaries go through
 * {@link CoordinateClassifier#boundarySafeFloor} so a longitude exactly on a boundary lands in the part
 * that starts there. D30 uses five unequal parts whose order is mirrored for even signs.</p>
 *
 * <p>Odd and even refer to the classical sign numbering: Aries (index 0) is odd.</p>
 */
public final class VargaTransforms {

    private static final double SIGN = EngineConfig.DEGREES_PER_SIGN;

    private static final int ARIES = 0;
    private static final int TAURUS = 1;
    private static final int GEMINI = 2;
    private static final int CANCER = 3;
    private static final int LEO = 4;
    private static final int VIRGO = 5;
    private static final int LIBRA = 6;
    private static final int SCORPIO = 7;
    private static final int SAGITTARIUS = 8;
    private static final int CAPRICORN = 9;
    private static final int AQUARIUS = 10;
    private static final int PISCES = 11;

    // D30: upper bound of each part in degrees, and the sign that part maps to
    private static final double[] TRIMSAMSA_ODD_BOUNDS = {5.0, 10.0, 18.0, 25.0, 30.0};
    private static final int[] TRIMSAMSA_ODD_SIGNS = {ARIES, AQUARIUS, SAGITTARIUS, GEMINI, TAURUS};
    private static final double[] TRIMSAMSA_EVEN_BOUNDS = {5.0, 12.0, 20.0, 25.0, 30.0};
    private static final int[] TRIMSAMSA_EVEN_SIGNS = {TAURUS, VIRGO, PISCES, CAPRICORN, SCORPIO};

    private static final Map<DivisionalChartType, VargaTransform> TRANSFORMS;

    static {
        Map<DivisionalChartType, VargaTransform> transforms = new EnumMap<>(DivisionalChartType.class);
        transforms.put(DivisionalChartType.D2_HORA,
                equalParts(2, (sign, part) -> isOdd(sign)
                        ? (part == 0 ? LEO : CANCER)
                        : (part == 0 ? CANCER : LEO)));
        transforms.put(DivisionalChartType.D3_DREKKANA,
                equalParts(3, (sign, part) -> sign + part * 4));
        transforms.put(DivisionalChartType.D4_CHATURTHAMSA,
                equalParts(4, (sign, part) -> sign + part * 3));
        transforms.put(DivisionalChartType.D7_SAPTAMSA,
                equalParts(7, (sign, part) -> (isOdd(sign) ? sign : sign + 6) + part));
        transforms.put(DivisionalChartType.D9_NAVAMSA,
                equalParts(9, (sign, part) -> byModality(sign, sign, sign + 8, sign + 4) + part));
        transforms.put(DivisionalChartType.D10_DASAMSA,
                equalParts(10, (sign, part) -> (isOdd(sign) ? sign : sign + 8) + part));
        transforms.put(DivisionalChartType.D12_DWADASAMSA,
                equalParts(12, (sign, part) -> sign + part));
        transforms.put(DivisionalChartType.D16_SHODASAMSA,
                equalParts(16, (sign, part) -> byModality(sign, ARIES, LEO, SAGITTARIUS) + part));
        transforms.put(DivisionalChartType.D20_VIMSAMSA,
                equalParts(20, (sign, part) -> byModality(sign, ARIES, SAGITTARIUS, LEO) + part));
        transforms.put(DivisionalChartType.D24_CHATURVIMSAMSA,
                equalParts(24, (sign, part) -> (isOdd(sign) ? LEO : CANCER) + part));
        transforms.put(DivisionalChartType.D27_SAPTAVIMSAMSA,
                equalParts(27, (sign, part) -> byElement(sign, ARIES, CANCER, LIBRA, CAPRICORN) + part));
        transforms.put(DivisionalChartType.D30_TRIMSAMSA, VargaTransforms::trimsamsa);
        transforms.put(DivisionalChartType.D60_SHASHTIAMSA,
                equalParts(60, (sign, part) -> (isOdd(sign) ? sign : sign + 6) + part));
        TRANSFORMS = Collections.unmodifiableMap(transforms);
    }

    private VargaTransforms() {}

    /**
     * Destination sign index (any integer, reduced mod 12 afterwards) for part {@code part} of sign
     * {@code signIndex}.
     */
    @FunctionalInterface
    public interface DestinationRule {
        int destinationSign(int signIndex, int part);
    }

    public static VargaTransform forType(DivisionalChartType type) {
        VargaTransform transform = TRANSFORMS.get(type);
        if (transform == null) {
            throw new IllegalArgumentException("No transform registered for " + type);
        }
        return transform;
    }

    public static double apply(DivisionalChartType type, double longitude) {
        return forType(type).apply(longitude);
    }

    /**
     * Index of the equal part of the sign a longitude falls in, 0-based.
     */
    public static int partIndex(double longitude, int parts) {
        double inSign = CoordinateClassifier.degreeInSign(longitude);
        int part = CoordinateClassifier.boundarySafeFloor(inSign * parts, SIGN);
        return Math.max(0, Math.min(parts - 1, part));
    }

    static VargaTransform equalParts(int parts, DestinationRule rule) {
        double partSize = SIGN / parts;
        return longitude -> {
            double normalized = CoordinateClassifier.normalize(longitude);
            int signIndex = CoordinateClassifier.signIndex(normalized);
            double inSign = CoordinateClassifier.degreeInSign(normalized);

            int part = partIndex(normalized, parts);
            double offsetInPart = Math.max(0.0, inSign - part * partSize);
            int destination = Math.floorMod(rule.destinationSign(signIndex, part), 12);
            return toLongitude(destination, offsetInPart / partSize * SIGN);
        };
    }

    static double trimsamsa(double longitude) {
        double normalized = CoordinateClassifier.normalize(longitude);
        int signIndex = CoordinateClassifier.signIndex(normalized);
        double inSign = CoordinateClassifier.degreeInSign(normalized);

        double[] bounds = isOdd(signIndex) ? TRIMSAMSA_ODD_BOUNDS : TRIMSAMSA_EVEN_BOUNDS;
        int[] signs = isOdd(signIndex) ? TRIMSAMSA_ODD_SIGNS : TRIMSAMSA_EVEN_SIGNS;

        double partStart = 0.0;
        for (int i = 0; i < bounds.length; i++) {
            if (inSign < bounds[i] || i == bounds.length - 1) {
                double width = bounds[i] - partStart;
                return toLongitude(signs[i], (inSign - partStart) / width * SIGN);
            }
            partStart = bounds[i];
        }
        throw new IllegalStateException("Unreachable: trimsamsa table exhausted for " + longitude);
    }

    private static double toLongitude(int signIndex, double degreeInSign) {
        double signStart = signIndex * SIGN;
        double signEnd = signStart + SIGN;
        double longitude = signStart + Math.max(0.0, degreeInSign);
        // stay inside the destination sign even when the addition rounds up
        if (longitude >= signEnd) {
            longitude = Math.nextDown(signEnd);
        }
        return CoordinateClassifier.normalize(longitude);
    }

    static boolean isOdd(int signIndex) {
        return signIndex % 2 == 0;
    }

    private static int byModality(int signIndex, int movable, int fixed, int dual) {
        switch (signIndex % 3) {
            case 0:
                return movable;
            case 1:
                return fixed;
            default:
                return dual;
        }
    }

    private static int byElement(int signIndex, int fire, int earth, int air, int water) {
        switch (signIndex % 4) {
            case 0:
                return fire;
            case 1:
                return earth;
            case 2:
                return air;
            default:
                return water;
        }
    }
}
