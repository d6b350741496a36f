package in.co.kundli.pojos;

/**
 * The thirteen divisional charts (vargas) computed from a natal chart.
 */
public enum DivisionalChartType {
    D2_HORA(2, "Hora", "D2", "Wealth, Prosperity"),
    D3_DREKKANA(3, "Drekkana", "D3", "Siblings, Courage"),
    D4_CHATURTHAMSA(4, "Chaturthamsa", "D4", "Fortune, Property"),
    D7_SAPTAMSA(7, "Saptamsa", "D7", "Children, Progeny"),
    D9_NAVAMSA(9, "Navamsa", "D9", "Marriage, Dharma"),
    D10_DASAMSA(10, "Dasamsa", "D10", "Career, Profession"),
    D12_DWADASAMSA(12, "Dwadasamsa", "D12", "Parents, Ancestry"),
    D16_SHODASAMSA(16, "Shodasamsa", "D16", "Vehicles, Pleasures"),
    D20_VIMSAMSA(20, "Vimsamsa", "D20", "Spiritual Life"),
    D24_CHATURVIMSAMSA(24, "Siddhamsa", "D24", "Education, Learning"),
    D27_SAPTAVIMSAMSA(27, "Bhamsa", "D27", "Strength, Weakness"),
    D30_TRIMSAMSA(30, "Trimsamsa", "D30", "Evils, Misfortunes"),
    D60_SHASHTIAMSA(60, "Shashtiamsa", "D60", "Past Life Karma");

    private final int division;
    private final String displayName;
    private final String shortName;
    private final String description;

    DivisionalChartType(int division, String displayName, String shortName, String description) {
        this.division = division;
        this.displayName = displayName;
        this.shortName = shortName;
        this.description = description;
    }

    public int getDivision() {
        return division;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getShortName() {
        return shortName;
    }

    public String getDescription() {
        return description;
    }

    public String getTitle() {
        return displayName + " (" + shortName + ")";
    }

    /**
     * @return the chart for the given division number (2, 3, 4, 7, 9, ...), or {@code null}
     */
    public static DivisionalChartType fromDivision(int division) {
        for (DivisionalChartType type : values()) {
            if (type.division == division) {
                return type;
            }
        }
        return null;
    }
}
