package in.co.kundli.pojos;

import java.util.List;

/**
 * Natal (or transit) chart: the moment it was cast for, the sidereal correction used,
 * the angles, every tracked body and the house cusps.
 */
public final class VedicChart {

    private final BirthMoment birthMoment;
    private final double julianDay;
    private final double ayanamsa;
    private final String ayanamsaName;
    private final double ascendant;
    private final double midheaven;
    private final List<BodyPosition> planetPositions;
    private final ChartCusps houseCusps;
    private final HouseSystem houseSystem;

    public VedicChart(BirthMoment birthMoment, double julianDay, double ayanamsa, String ayanamsaName,
                      double ascendant, double midheaven, List<BodyPosition> planetPositions,
                      ChartCusps houseCusps, HouseSystem houseSystem) {
        this.birthMoment = birthMoment;
        this.julianDay = julianDay;
        this.ayanamsa = ayanamsa;
        this.ayanamsaName = ayanamsaName;
        this.ascendant = ascendant;
        this.midheaven = midheaven;
        this.planetPositions = List.copyOf(planetPositions);
        this.houseCusps = houseCusps;
        this.houseSystem = houseSystem;
    }

    public BirthMoment getBirthMoment() {
        return birthMoment;
    }

    public double getJulianDay() {
        return julianDay;
    }

    public double getAyanamsa() {
        return ayanamsa;
    }

    public String getAyanamsaName() {
        return ayanamsaName;
    }

    public double getAscendant() {
        return ascendant;
    }

    public ZodiacSign getAscendantSign() {
        return ZodiacSign.fromLongitude(ascendant);
    }

    public double getMidheaven() {
        return midheaven;
    }

    public List<BodyPosition> getPlanetPositions() {
        return planetPositions;
    }

    /**
     * @return the position of the given body, or {@code null} if it is not tracked in this chart
     */
    public BodyPosition getPosition(Planet planet) {
        for (BodyPosition position : planetPositions) {
            if (position.getPlanet() == planet) {
                return position;
            }
        }
        return null;
    }

    public ChartCusps getHouseCusps() {
        return houseCusps;
    }

    public HouseSystem getHouseSystem() {
        return houseSystem;
    }

    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        sb.append("═══════════════════════════════════════════════════\n");
        sb.append("           VEDIC BIRTH CHART (D1)\n");
        sb.append("═══════════════════════════════════════════════════\n\n");
        sb.append("Date/Time : ").append(birthMoment.getFormattedDateTime())
                .append(" (").append(birthMoment.getTimezone()).append(")\n");
        sb.append("Location  : ").append(birthMoment.getFormattedCoordinates()).append('\n');
        sb.append("Ayanamsa  : ").append(ayanamsaName).append(' ').append(DegreeFormat.formatDegree(ayanamsa)).append('\n');
        sb.append("Houses    : ").append(houseSystem.getDisplayName()).append("\n\n");
        sb.append("Ascendant : ").append(DegreeFormat.formatDegree(ascendant))
                .append(" (").append(getAscendantSign().getDisplayName()).append(")\n");
        sb.append("Midheaven : ").append(DegreeFormat.formatDegree(midheaven))
                .append(" (").append(ZodiacSign.fromLongitude(midheaven).getDisplayName()).append(")\n\n");
        sb.append("PLANETARY POSITIONS\n");
        sb.append("───────────────────────────────────────────────────\n");
        for (BodyPosition position : planetPositions) {
            appendPositionLine(sb, position);
            sb.append(" | ").append(position.getNakshatra().getDisplayName()).append(" pada ").append(position.getPada());
            sb.append('\n');
        }
        return sb.toString();
    }

    static void appendPositionLine(StringBuilder sb, BodyPosition position) {
        sb.append(String.format("%-10s", position.getPlanet().getDisplayName())).append(": ")
                .append(String.format("%-12s", position.getSign().getDisplayName())).append(' ')
                .append(DegreeFormat.formatDegreeInSign(position.getLongitude()))
                .append(position.isRetrograde() ? " [R]" : "")
                .append(" | House ").append(position.getHouse());
    }
}
