package in.co.kundli.pojos;

import in.co.kundli.provider.ProviderConstants;

import java.util.List;

/**
 * Bodies tracked in a chart. Rahu is the mean lunar node; Ketu has no provider body of its own
 * and is derived from Rahu (see {@code BodyDerivation}).
 */
public enum Planet {
    SUN(ProviderConstants.SUN, "Sun", "Su"),
    MOON(ProviderConstants.MOON, "Moon", "Mo"),
    MARS(ProviderConstants.MARS, "Mars", "Ma"),
    MERCURY(ProviderConstants.MERCURY, "Mercury", "Me"),
    JUPITER(ProviderConstants.JUPITER, "Jupiter", "Ju"),
    VENUS(ProviderConstants.VENUS, "Venus", "Ve"),
    SATURN(ProviderConstants.SATURN, "Saturn", "Sa"),
    RAHU(ProviderConstants.MEAN_NODE, "Rahu", "Ra"),
    KETU(ProviderConstants.MEAN_NODE, "Ketu", "Ke"),
    URANUS(ProviderConstants.URANUS, "Uranus", "Ur"),
    NEPTUNE(ProviderConstants.NEPTUNE, "Neptune", "Ne"),
    PLUTO(ProviderConstants.PLUTO, "Pluto", "Pl");

    /** The nine grahas of Vedic astrology. */
    public static final List<Planet> MAIN_PLANETS = List.of(
            SUN, MOON, MARS, MERCURY, JUPITER, VENUS, SATURN, RAHU, KETU);

    /** Grahas plus the outer planets, in chart order. */
    public static final List<Planet> ALL_PLANETS = List.of(values());

    private final int providerBodyId;
    private final String displayName;
    private final String symbol;

    Planet(int providerBodyId, String displayName, String symbol) {
        this.providerBodyId = providerBodyId;
        this.displayName = displayName;
        this.symbol = symbol;
    }

    public int getProviderBodyId() {
        return providerBodyId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isNode() {
        return this == RAHU || this == KETU;
    }

    public static Planet fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (Planet planet : values()) {
            if (planet.name().equalsIgnoreCase(trimmed) || planet.displayName.equalsIgnoreCase(trimmed)) {
                return planet;
            }
        }
        return null;
    }
}
