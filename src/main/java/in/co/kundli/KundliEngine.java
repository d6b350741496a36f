package in.co.kundli;

import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.BodyPosition;
import in.co.kundli.pojos.DivisionalChartResult;
import in.co.kundli.pojos.DivisionalChartType;
import in.co.kundli.pojos.EngineSettings;
import in.co.kundli.pojos.HouseSystem;
import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.VedicChart;
import in.co.kundli.provider.EphemerisProvider;
import in.co.kundli.services.ChartAssembler;
import in.co.kundli.services.ChartExportService;
import in.co.kundli.services.DivisionalChartEngine;
import in.co.kundli.services.EngineSettingsLoader;
import in.co.kundli.services.EphemerisAccessor;
import in.co.kundli.services.HouseSystemCalculator;
import in.co.kundli.services.LoggingService;
import in.co.kundli.services.TransitChartService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for callers: one ephemeris session plus the services built on it.
 *
 * <p>Safe to share across threads. Closing the engine closes the underlying {@link EphemerisAccessor};
 * every later call fails with {@link in.co.kundli.exceptions.ClosedStateException}.</p>
 */
public class KundliEngine implements AutoCloseable {

    private final EphemerisAccessor accessor;
    private final HouseSystem houseSystem;
    private final HouseSystemCalculator houseSystemCalculator;
    private final ChartAssembler chartAssembler;
    private final DivisionalChartEngine divisionalChartEngine;
    private final TransitChartService transitChartService;
    private final ChartExportService chartExportService;

    KundliEngine(EphemerisAccessor accessor, HouseSystem houseSystem, List<Planet> trackedBodies) {
        this.accessor = accessor;
        this.houseSystem = houseSystem;
        this.houseSystemCalculator = new HouseSystemCalculator(accessor);
        this.chartAssembler = new ChartAssembler(accessor, trackedBodies);
        this.divisionalChartEngine = new DivisionalChartEngine();
        this.transitChartService = new TransitChartService(chartAssembler);
        this.chartExportService = new ChartExportService();
    }

    /**
     * Opens an engine with settings read from {@code kundli-settings.json} in the working directory.
     */
    public static KundliEngine open(EphemerisProvider provider) {
        return open(provider, new EngineSettingsLoader().load());
    }

    public static KundliEngine open(EphemerisProvider provider, EngineSettings settings) {
        HouseSystem houseSystem = EngineSettingsLoader.resolveHouseSystem(settings);
        List<Planet> trackedBodies = EngineSettingsLoader.resolveTrackedBodies(settings);
        EphemerisAccessor accessor = EphemerisAccessor.create(provider,
                EngineSettingsLoader.resolveAyanamsa(settings),
                EngineSettingsLoader.resolveEphemerisDir(settings));

        LoggingService.info("kundli_engine_opened", Map.of(
                "ayanamsa", accessor.getAyanamsaType().getDisplayName(),
                "houseSystem", houseSystem.getDisplayName(),
                "trackedBodies", trackedBodies.size()));
        return new KundliEngine(accessor, houseSystem, trackedBodies);
    }

    public VedicChart calculateChart(BirthMoment birthMoment) {
        return inRequest("calculate_chart", () -> chartAssembler.calculateChart(birthMoment, houseSystem));
    }

    public VedicChart calculateChart(BirthMoment birthMoment, HouseSystem houseSystem) {
        return inRequest("calculate_chart", () -> chartAssembler.calculateChart(birthMoment, houseSystem));
    }

    public BodyPosition calculatePlanetPosition(Planet planet, LocalDateTime dateTime, String timezone,
                                                double latitude, double longitude) {
        return inRequest("calculate_planet_position",
                () -> chartAssembler.calculatePlanetPosition(planet, dateTime, timezone, latitude, longitude));
    }

    public DivisionalChartResult calculateDivisionalChart(VedicChart chart, DivisionalChartType type) {
        return inRequest("calculate_divisional_chart", () -> divisionalChartEngine.calculate(chart, type));
    }

    public List<DivisionalChartResult> calculateAllDivisionalCharts(VedicChart chart) {
        return inRequest("calculate_all_divisional_charts", () -> divisionalChartEngine.calculateAll(chart));
    }

    public VedicChart getTransitChart(VedicChart natalChart, LocalDate date) {
        return inRequest("get_transit_chart", () -> transitChartService.getTransitChart(natalChart, date));
    }

    public String exportJson(VedicChart chart) {
        return inRequest("export_json",
                () -> chartExportService.toJson(chart, divisionalChartEngine.calculateAll(chart)));
    }

    public double ayanamsaFor(LocalDateTime dateTime, String timezone) {
        return inRequest("ayanamsa_for", () -> accessor.ayanamsaFor(dateTime, timezone));
    }

    /**
     * Runs one public operation with a fresh request id and the operation name in the logging context,
     * and clears that context afterwards.
     */
    private static <T> T inRequest(String function, Supplier<T> work) {
        LoggingService.initRequest(UUID.randomUUID().toString());
        LoggingService.setFunction(function);
        try {
            return work.get();
        } finally {
            LoggingService.clearContext();
        }
    }

    public EphemerisAccessor getAccessor() {
        return accessor;
    }

    public HouseSystem getHouseSystem() {
        return houseSystem;
    }

    public HouseSystemCalculator getHouseSystemCalculator() {
        return houseSystemCalculator;
    }

    public ChartAssembler getChartAssembler() {
        return chartAssembler;
    }

    public DivisionalChartEngine getDivisionalChartEngine() {
        return divisionalChartEngine;
    }

    public TransitChartService getTransitChartService() {
        return transitChartService;
    }

    public ChartExportService getChartExportService() {
        return chartExportService;
    }

    @Override
    public void close() {
        transitChartService.clearCache();
        accessor.close();
        LoggingService.info("kundli_engine_closed");
    }
}
