package in.co.kundli.pojos;

/**
 * The twelve sidereal signs. {@link #getIndex()} is 0-based (Aries = 0), {@link #getNumber()} 1-based.
 */
public enum ZodiacSign {
    ARIES(1, "Aries", "Ar", Planet.MARS, Element.FIRE, Modality.MOVABLE),
    TAURUS(2, "Taurus", "Ta", Planet.VENUS, Element.EARTH, Modality.FIXED),
    GEMINI(3, "Gemini", "Ge", Planet.MERCURY, Element.AIR, Modality.DUAL),
    CANCER(4, "Cancer", "Cn", Planet.MOON, Element.WATER, Modality.MOVABLE),
    LEO(5, "Leo", "Le", Planet.SUN, Element.FIRE, Modality.FIXED),
    VIRGO(6, "Virgo", "Vi", Planet.MERCURY, Element.EARTH, Modality.DUAL),
    LIBRA(7, "Libra", "Li", Planet.VENUS, Element.AIR, Modality.MOVABLE),
    SCORPIO(8, "Scorpio", "Sc", Planet.MARS, Element.WATER, Modality.FIXED),
    SAGITTARIUS(9, "Sagittarius", "Sg", Planet.JUPITER, Element.FIRE, Modality.DUAL),
    CAPRICORN(10, "Capricorn", "Cp", Planet.SATURN, Element.EARTH, Modality.MOVABLE),
    AQUARIUS(11, "Aquarius", "Aq", Planet.SATURN, Element.AIR, Modality.FIXED),
    PISCES(12, "Pisces", "Pi", Planet.JUPITER, Element.WATER, Modality.DUAL);

    public enum Element { FIRE, EARTH, AIR, WATER }

    public enum Modality { MOVABLE, FIXED, DUAL }

    private static final ZodiacSign[] BY_INDEX = values();

    private final int number;
    private final String displayName;
    private final String abbreviation;
    private final Planet ruler;
    private final Element element;
    private final Modality modality;

    ZodiacSign(int number, String displayName, String abbreviation, Planet ruler,
               Element element, Modality modality) {
        this.number = number;
        this.displayName = displayName;
        this.abbreviation = abbreviation;
        this.ruler = ruler;
        this.element = element;
        this.modality = modality;
    }

    public int getNumber() {
        return number;
    }

    public int getIndex() {
        return number - 1;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public Planet getRuler() {
        return ruler;
    }

    public Element getElement() {
        return element;
    }

    public Modality getModality() {
        return modality;
    }

    /**
     * Odd signs in the Vedic sense (Aries, Gemini, ...), i.e. even 0-based index.
     */
    public boolean isOdd() {
        return number % 2 == 1;
    }

    public ZodiacSign plus(int signs) {
        return fromIndex(getIndex() + signs);
    }

    /**
     * Sign for any index; wraps modulo 12, including negative indices.
     */
    public static ZodiacSign fromIndex(int index) {
        return BY_INDEX[Math.floorMod(index, 12)];
    }

    public static ZodiacSign fromLongitude(double longitude) {
        double normalized = ((longitude % 360.0) + 360.0) % 360.0;
        return fromIndex((int) Math.floor(normalized / 30.0));
    }
}
