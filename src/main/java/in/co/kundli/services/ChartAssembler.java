package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.BodyPosition;
import in.co.kundli.pojos.ChartCusps;
import in.co.kundli.pojos.HouseSystem;
import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.RawPosition;
import in.co.kundli.pojos.VedicChart;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Casts a full sidereal chart: ayanamsa, cusps and angles, then every tracked body classified and housed.
 *
 * <p>The whole sequence of provider calls for one chart runs inside a single
 * {@link EphemerisAccessor#calculateExclusively} block so that no other chart can interleave with it.</p>
 */
public class ChartAssembler {

    private final EphemerisAccessor accessor;
    private final List<Planet> trackedBodies;

    public ChartAssembler(EphemerisAccessor accessor) {
        this(accessor, Planet.ALL_PLANETS);
    }

    public ChartAssembler(EphemerisAccessor accessor, List<Planet> trackedBodies) {
        if (trackedBodies == null || trackedBodies.isEmpty()) {
            throw new ValidationException("At least one tracked body is required");
        }
        this.accessor = accessor;
        this.trackedBodies = List.copyOf(trackedBodies);
    }

    public List<Planet> getTrackedBodies() {
        return trackedBodies;
    }

    public VedicChart calculateChart(BirthMoment birthMoment) {
        return calculateChart(birthMoment, EngineConfig.DEFAULT_HOUSE_SYSTEM);
    }

    public VedicChart calculateChart(BirthMoment birthMoment, HouseSystem houseSystem) {
        if (birthMoment == null) {
            throw new ValidationException("Birth moment is required");
        }
        HouseSystem system = houseSystem == null ? EngineConfig.DEFAULT_HOUSE_SYSTEM : houseSystem;
        double julianDay = TimeConverter.julianDay(birthMoment);

        String chartId = UUID.randomUUID().toString();
        LoggingService.setChartId(chartId);
        long startTime = LoggingService.logOperationStart("calculate_chart", Map.of(
                "dateTime", birthMoment.getFormattedDateTime(),
                "timezone", birthMoment.getTimezone(),
                "houseSystem", system.getDisplayName(),
                "julianDay", julianDay));
        try {
            VedicChart chart = accessor.calculateExclusively(session -> {
                double ayanamsa = session.ayanamsa(julianDay);
                ChartCusps cusps = session.houses(julianDay, birthMoment.getLatitude(), birthMoment.getLongitude(), system);

                List<BodyPosition> positions = new ArrayList<>(trackedBodies.size());
                for (Planet planet : trackedBodies) {
                    RawPosition raw = session.position(planet, julianDay);
                    int house = HouseSystemCalculator.houseOf(raw.longitude, cusps);
                    positions.add(CoordinateClassifier.toBodyPosition(raw, house));
                }

                return new VedicChart(birthMoment, julianDay, ayanamsa, accessor.getAyanamsaType().getDisplayName(),
                        cusps.getAscendant(), cusps.getMidheaven(), positions, cusps, system);
            });
            LoggingService.logOperationEnd("calculate_chart", startTime, Map.of(
                    "ascendantSign", chart.getAscendantSign().getDisplayName(),
                    "bodies", chart.getPlanetPositions().size()));
            return chart;
        } catch (RuntimeException e) {
            LoggingService.logOperationFailed("calculate_chart", startTime, e);
            throw e;
        } finally {
            LoggingService.clearChartId();
        }
    }

    /**
     * One fully classified body, housed with Placidus cusps for the given place.
     */
    public BodyPosition calculatePlanetPosition(Planet planet, LocalDateTime dateTime, String timezone,
                                                double latitude, double longitude) {
        if (planet == null) {
            throw new ValidationException("Planet is required");
        }
        BirthMoment moment = BirthMoment.of(dateTime, timezone, latitude, longitude);
        double julianDay = TimeConverter.julianDay(moment);

        return accessor.calculateExclusively(session -> {
            RawPosition raw = session.position(planet, julianDay);
            ChartCusps cusps = session.houses(julianDay, latitude, longitude, HouseSystem.PLACIDUS);
            return CoordinateClassifier.toBodyPosition(raw, HouseSystemCalculator.houseOf(raw.longitude, cusps));
        });
    }
}
