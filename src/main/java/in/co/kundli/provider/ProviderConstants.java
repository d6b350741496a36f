package in.co.kundli.provider;

/**
 * Body identifiers, calculation flags and sidereal modes understood by an {@link EphemerisProvider}.
 * Values follow the Swiss Ephemeris numbering so that a Swiss Ephemeris backed provider can pass
 * them through unchanged.
 */
public final class ProviderConstants {

    private ProviderConstants() {}

    // Bodies
    public static final int SUN = 0;
    public static final int MOON = 1;
    public static final int MERCURY = 2;
    public static final int VENUS = 3;
    public static final int MARS = 4;
    public static final int JUPITER = 5;
    public static final int SATURN = 6;
    public static final int URANUS = 7;
    public static final int NEPTUNE = 8;
    public static final int PLUTO = 9;
    public static final int MEAN_NODE = 10;
    public static final int TRUE_NODE = 11;

    // Flags
    public static final int FLAG_HIGH_PRECISION = 1;
    public static final int FLAG_SPEED = 256;
    public static final int FLAG_SIDEREAL = 64 * 1024;

    // Sidereal modes
    public static final int SIDM_FAGAN_BRADLEY = 0;
    public static final int SIDM_LAHIRI = 1;
    public static final int SIDM_RAMAN = 3;
    public static final int SIDM_KRISHNAMURTI = 5;
    public static final int SIDM_YUKTESHWAR = 7;
    public static final int SIDM_TRUE_CITRA = 27;

    // Return codes
    public static final int OK = 0;
    public static final int ERR = -1;

    // Result array sizes
    public static final int POSITION_RESULT_SIZE = 6;
    public static final int HOUSE_CUSPS_SIZE = 13;
    public static final int ASC_MC_SIZE = 10;
    public static final int ASC_INDEX = 0;
    public static final int MC_INDEX = 1;
}
