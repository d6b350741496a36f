package in.co.kundli.services;

import in.co.kundli.pojos.AyanamsaType;
import in.co.kundli.pojos.HouseSystem;

import java.util.regex.Pattern;

/**
 * Configuration constants for the chart engine.
 * Runtime overrides come from {@link EngineSettingsLoader}; everything here is the default.
 */
public class EngineConfig {

    // Defaults
    public static final AyanamsaType DEFAULT_AYANAMSA = AyanamsaType.LAHIRI;
    public static final HouseSystem DEFAULT_HOUSE_SYSTEM = HouseSystem.DEFAULT;
    public static final String SETTINGS_FILE = "kundli-settings.json";

    // Geometry
    public static final double DEGREES_PER_CIRCLE = 360.0;
    public static final double DEGREES_PER_SIGN = 30.0;
    public static final double MINUTES_PER_DEGREE = 60.0;
    public static final double SECONDS_PER_MINUTE = 60.0;
    public static final double KETU_OFFSET = 180.0;

    // Houses narrower than this (polar latitudes, some systems) are treated as a full sign
    public static final double DEGENERATE_HOUSE_WIDTH = 0.001;

    // Quotients within this distance of a whole number snap onto it (nakshatra, pada and varga part boundaries)
    public static final double BOUNDARY_SNAP_TOLERANCE = 1e-10;

    // Scratch buffers
    public static final int ERROR_BUFFER_SIZE = 256;

    // Ephemeris data files that enable the high-precision mode
    public static final Pattern JPL_EPHEMERIS_PATTERN = Pattern.compile("^de\\d{3}[ls]?\\.eph$", Pattern.CASE_INSENSITIVE);
    public static final Pattern SWISS_EPHEMERIS_PATTERN = Pattern.compile("^se.*\\.se1$", Pattern.CASE_INSENSITIVE);

    // Transit charts are cast for local noon
    public static final int TRANSIT_HOUR = 12;
    public static final int MAX_TRANSIT_CACHE_SIZE = 30;
    public static final int TRANSIT_CACHE_RETENTION_DAYS = 7;

    /**
     * Check if a file name is a recognised high-precision ephemeris data file
     */
    public static boolean isHighPrecisionDataFile(String fileName) {
        return JPL_EPHEMERIS_PATTERN.matcher(fileName).matches()
                || SWISS_EPHEMERIS_PATTERN.matcher(fileName).matches();
    }
}
