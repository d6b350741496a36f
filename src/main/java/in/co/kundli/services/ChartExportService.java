package in.co.kundli.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.BodyPosition;
import in.co.kundli.pojos.DivisionalChartResult;
import in.co.kundli.pojos.VedicChart;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of natal and divisional charts for persistence and rendering consumers.
 * Signs are exported by number (1 = Aries), nakshatras by number (1 = Ashwini).
 */
public class ChartExportService {

    private final Gson gson;

    public ChartExportService() {
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public String toJson(VedicChart chart) {
        return gson.toJson(chartToMap(chart));
    }

    /**
     * Natal chart plus its divisional charts under {@code "divisional_charts"}, keyed "D2", "D9", ...
     */
    public String toJson(VedicChart chart, List<DivisionalChartResult> divisionalCharts) {
        Map<String, Object> root = chartToMap(chart);
        Map<String, Object> charts = new LinkedHashMap<>();
        for (DivisionalChartResult result : divisionalCharts) {
            charts.put(result.getChartType().getShortName(), divisionalChartToMap(result));
        }
        root.put("divisional_charts", charts);
        return gson.toJson(root);
    }

    public String toJson(DivisionalChartResult result) {
        return gson.toJson(divisionalChartToMap(result));
    }

    Map<String, Object> chartToMap(VedicChart chart) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("birth", birthToMap(chart.getBirthMoment()));
        map.put("julian_day", chart.getJulianDay());
        map.put("ayanamsa", chart.getAyanamsa());
        map.put("ayanamsa_name", chart.getAyanamsaName());
        map.put("house_system", chart.getHouseSystem().getDisplayName());
        map.put("ascendant", chart.getAscendant());
        map.put("ascendant_sign", chart.getAscendantSign().getNumber());
        map.put("midheaven", chart.getMidheaven());
        map.put("house_cusps", chart.getHouseCusps().getCusps());
        map.put("planets", positionsToList(chart.getPlanetPositions()));
        return map;
    }

    Map<String, Object> divisionalChartToMap(DivisionalChartResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("chart", result.getChartType().getShortName());
        map.put("name", result.getChartType().getDisplayName());
        map.put("ascendant", result.getAscendantLongitude());
        map.put("ascendant_sign", result.getAscendantSign().getNumber());
        map.put("planets", positionsToList(result.getPlanetPositions()));
        return map;
    }

    private static Map<String, Object> birthToMap(BirthMoment birth) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!birth.getName().isEmpty()) {
            map.put("name", birth.getName());
        }
        map.put("date_time", birth.getDateTime().toString());
        map.put("timezone", birth.getTimezone());
        map.put("latitude", birth.getLatitude());
        map.put("longitude", birth.getLongitude());
        if (!birth.getLocation().isEmpty()) {
            map.put("location", birth.getLocation());
        }
        return map;
    }

    private static List<Map<String, Object>> positionsToList(List<BodyPosition> positions) {
        List<Map<String, Object>> list = new ArrayList<>(positions.size());
        for (BodyPosition position : positions) {
            Map<String, Object> planet = new LinkedHashMap<>();
            planet.put("name", position.getPlanet().getDisplayName());
            planet.put("longitude", position.getLongitude());
            planet.put("sign", position.getSign().getNumber());
            planet.put("degree", position.getFormattedDegreeInSign());
            planet.put("nakshatra", position.getNakshatra().getNumber());
            planet.put("pada", position.getPada());
            planet.put("house", position.getHouse());
            planet.put("speed", position.getSpeed());
            planet.put("retrograde", position.isRetrograde());
            list.add(planet);
        }
        return list;
    }
}
