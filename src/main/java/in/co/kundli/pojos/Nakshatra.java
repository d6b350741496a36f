package in.co.kundli.pojos;

/**
 * The 27 lunar mansions, each spanning 13°20' and split into four padas of 3°20'.
 * The 108 padas map one-to-one onto the 108 navamsas, so pada signs are pure index arithmetic.
 */
public enum Nakshatra {
    ASHWINI(1, "Ashwini", Planet.KETU, "Ashwini Kumaras"),
    BHARANI(2, "Bharani", Planet.VENUS, "Yama"),
    KRITTIKA(3, "Krittika", Planet.SUN, "Agni"),
    ROHINI(4, "Rohini", Planet.MOON, "Brahma"),
    MRIGASHIRA(5, "Mrigashira", Planet.MARS, "Soma"),
    ARDRA(6, "Ardra", Planet.RAHU, "Rudra"),
    PUNARVASU(7, "Punarvasu", Planet.JUPITER, "Aditi"),
    PUSHYA(8, "Pushya", Planet.SATURN, "Brihaspati"),
    ASHLESHA(9, "Ashlesha", Planet.MERCURY, "Sarpa"),
    MAGHA(10, "Magha", Planet.KETU, "Pitris"),
    PURVA_PHALGUNI(11, "Purva Phalguni", Planet.VENUS, "Bhaga"),
    UTTARA_PHALGUNI(12, "Uttara Phalguni", Planet.SUN, "Aryaman"),
    HASTA(13, "Hasta", Planet.MOON, "Savitar"),
    CHITRA(14, "Chitra", Planet.MARS, "Tvashtar"),
    SWATI(15, "Swati", Planet.RAHU, "Vayu"),
    VISHAKHA(16, "Vishakha", Planet.JUPITER, "Indra-Agni"),
    ANURADHA(17, "Anuradha", Planet.SATURN, "Mitra"),
    JYESHTHA(18, "Jyeshtha", Planet.MERCURY, "Indra"),
    MULA(19, "Mula", Planet.KETU, "Nirriti"),
    PURVA_ASHADHA(20, "Purva Ashadha", Planet.VENUS, "Apas"),
    UTTARA_ASHADHA(21, "Uttara Ashadha", Planet.SUN, "Vishwadevas"),
    SHRAVANA(22, "Shravana", Planet.MOON, "Vishnu"),
    DHANISHTHA(23, "Dhanishtha", Planet.MARS, "Vasus"),
    SHATABHISHA(24, "Shatabhisha", Planet.RAHU, "Varuna"),
    PURVA_BHADRAPADA(25, "Purva Bhadrapada", Planet.JUPITER, "Aja Ekapada"),
    UTTARA_BHADRAPADA(26, "Uttara Bhadrapada", Planet.SATURN, "Ahir Budhnya"),
    REVATI(27, "Revati", Planet.MERCURY, "Pushan");

    public static final int COUNT = 27;
    public static final double SPAN_DEGREES = 360.0 / COUNT;
    public static final double PADA_SPAN_DEGREES = SPAN_DEGREES / 4.0;

    private static final Nakshatra[] BY_INDEX = values();

    private final int number;
    private final String displayName;
    private final Planet ruler;
    private final String deity;

    Nakshatra(int number, String displayName, Planet ruler, String deity) {
        this.number = number;
        this.displayName = displayName;
        this.ruler = ruler;
        this.deity = deity;
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

    public Planet getRuler() {
        return ruler;
    }

    public String getDeity() {
        return deity;
    }

    public double getStartDegree() {
        return getIndex() * SPAN_DEGREES;
    }

    public double getEndDegree() {
        return number * SPAN_DEGREES;
    }

    /**
     * Navamsa (D9) sign of the given pada (1-4).
     */
    public ZodiacSign getPadaNavamsaSign(int pada) {
        return ZodiacSign.fromIndex(absolutePada(pada));
    }

    /**
     * Sign of the zodiac in which the given pada (1-4) lies.
     */
    public ZodiacSign getPadaSign(int pada) {
        return ZodiacSign.fromIndex(absolutePada(pada) / 9);
    }

    private int absolutePada(int pada) {
        if (pada < 1 || pada > 4) {
            throw new IllegalArgumentException("Pada must be between 1 and 4, got: " + pada);
        }
        return getIndex() * 4 + (pada - 1);
    }

    public static Nakshatra fromIndex(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Nakshatra index must be between 0 and 26, got: " + index);
        }
        return BY_INDEX[index];
    }
}
