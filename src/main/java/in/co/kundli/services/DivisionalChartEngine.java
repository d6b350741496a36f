package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.BodyPosition;
import in.co.kundli.pojos.DivisionalChartResult;
import in.co.kundli.pojos.DivisionalChartType;
import in.co.kundli.pojos.VedicChart;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Projects a natal chart into its divisional charts.
 *
 * <p>The ascendant and every body go through the same {@link VargaTransform}. Each projected body is then
 * classified again and housed by whole sign from the projected ascendant's sign; the natal cusps play no
 * part. Latitude, distance and speed carry over unchanged.</p>
 */
public class DivisionalChartEngine {

    private static final List<DivisionalChartType> COMMON_CHARTS = List.of(
            DivisionalChartType.D9_NAVAMSA,
            DivisionalChartType.D10_DASAMSA);

    public DivisionalChartResult calculate(VedicChart chart, DivisionalChartType type) {
        if (chart == null) {
            throw new ValidationException("Chart is required");
        }
        if (type == null) {
            throw new ValidationException("Divisional chart type is required");
        }
        VargaTransform transform = VargaTransforms.forType(type);

        double ascendant = transform.apply(chart.getAscendant());
        int ascendantSign = CoordinateClassifier.signIndex(ascendant);

        List<BodyPosition> positions = new ArrayList<>(chart.getPlanetPositions().size());
        for (BodyPosition natal : chart.getPlanetPositions()) {
            positions.add(project(natal, transform, ascendantSign));
        }

        LoggingService.debug("divisional_chart_calculated", Map.of(
                "chart", type.getShortName(),
                "ascendantSign", CoordinateClassifier.sign(ascendant).getDisplayName()));
        return new DivisionalChartResult(type, ascendant, positions);
    }

    /**
     * All thirteen charts, D2 through D60.
     */
    public List<DivisionalChartResult> calculateAll(VedicChart chart) {
        long startTime = LoggingService.logOperationStart("calculate_divisional_charts");
        try {
            List<DivisionalChartResult> results = new ArrayList<>(DivisionalChartType.values().length);
            for (DivisionalChartType type : DivisionalChartType.values()) {
                results.add(calculate(chart, type));
            }
            LoggingService.logOperationEnd("calculate_divisional_charts", startTime, Map.of("charts", results.size()));
            return results;
        } catch (RuntimeException e) {
            LoggingService.logOperationFailed("calculate_divisional_charts", startTime, e);
            throw e;
        }
    }

    /**
     * Navamsa and Dasamsa.
     */
    public List<DivisionalChartResult> calculateCommon(VedicChart chart) {
        List<DivisionalChartResult> results = new ArrayList<>(COMMON_CHARTS.size());
        for (DivisionalChartType type : COMMON_CHARTS) {
            results.add(calculate(chart, type));
        }
        return results;
    }

    static BodyPosition project(BodyPosition natal, VargaTransform transform, int ascendantSign) {
        CoordinateClassifier.Classification c = CoordinateClassifier.classify(transform.apply(natal.getLongitude()));
        int house = HouseSystemCalculator.wholeSignHouse(c.sign.getIndex(), ascendantSign);
        return new BodyPosition(natal.getPlanet(), c.longitude, natal.getLatitude(), natal.getDistance(),
                natal.getSpeed(), c.sign, c.degree, c.minute, c.second, c.nakshatra, c.pada, house);
    }
}
