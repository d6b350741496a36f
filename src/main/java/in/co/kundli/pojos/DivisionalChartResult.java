package in.co.kundli.pojos;

import java.util.List;
import java.util.Locale;

/**
 * One divisional chart: its transformed ascendant and every body re-classified and
 * re-housed by whole-sign counting from that ascendant.
 */
public final class DivisionalChartResult {

    private final DivisionalChartType chartType;
    private final double ascendantLongitude;
    private final List<BodyPosition> planetPositions;

    public DivisionalChartResult(DivisionalChartType chartType, double ascendantLongitude,
                                 List<BodyPosition> planetPositions) {
        this.chartType = chartType;
        this.ascendantLongitude = ascendantLongitude;
        this.planetPositions = List.copyOf(planetPositions);
    }

    public DivisionalChartType getChartType() {
        return chartType;
    }

    public double getAscendantLongitude() {
        return ascendantLongitude;
    }

    public ZodiacSign getAscendantSign() {
        return ZodiacSign.fromLongitude(ascendantLongitude);
    }

    public List<BodyPosition> getPlanetPositions() {
        return planetPositions;
    }

    public BodyPosition getPosition(Planet planet) {
        for (BodyPosition position : planetPositions) {
            if (position.getPlanet() == planet) {
                return position;
            }
        }
        return null;
    }

    public String getChartTitle() {
        return chartType.getTitle();
    }

    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        sb.append("═══════════════════════════════════════════════════\n");
        sb.append("           ").append(chartType.getDisplayName().toUpperCase(Locale.ROOT))
                .append(" CHART (").append(chartType.getShortName()).append(")\n");
        sb.append("           ").append(chartType.getDescription()).append('\n');
        sb.append("═══════════════════════════════════════════════════\n\n");
        sb.append("Ascendant: ").append(DegreeFormat.formatDegree(ascendantLongitude))
                .append(" (").append(getAscendantSign().getDisplayName()).append(")\n\n");
        sb.append("PLANETARY POSITIONS\n");
        sb.append("───────────────────────────────────────────────────\n");
        for (BodyPosition position : planetPositions) {
            VedicChart.appendPositionLine(sb, position);
            sb.append('\n');
        }
        return sb.toString();
    }
}
