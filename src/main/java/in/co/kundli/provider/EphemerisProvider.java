package in.co.kundli.provider;

/**
 * Opaque numerical ephemeris provider.
 *
 * <p>Implementations are NOT assumed safe for uncoordinated concurrent calls: the provider
 * holds configuration state (data path, sidereal mode) shared by every call, and writes its
 * results into caller-owned arrays. {@code EphemerisAccessor} supplies the locking.</p>
 *
 * <p>Result conventions:</p>
 * <ul>
 *   <li>{@link #calculate}: {@code result[0..3]} = longitude, latitude, distance, longitude speed
 *       (degrees/day). Returns a negative code on failure and appends diagnostics to {@code error}.</li>
 *   <li>{@link #houses}: {@code cusps[1..12]} = house cusps ({@code cusps[0]} unused),
 *       {@code ascMc[0]} = ascendant, {@code ascMc[1]} = midheaven. Returns a negative code on failure.</li>
 * </ul>
 */
public interface EphemerisProvider {

    /**
     * Points the provider at a directory of higher-precision data files, or {@code null} for
     * the built-in algorithms.
     */
    void setEphemerisPath(String path);

    /**
     * Selects the sidereal (ayanamsa) mode used by {@link #ayanamsa} and by sidereal calculations.
     */
    void setSiderealMode(int siderealMode);

    int calculate(double julianDay, int bodyId, int flags, double[] result, StringBuilder error);

    double ayanamsa(double julianDay);

    int houses(double julianDay, int flags, double latitude, double longitude, int houseSystem,
               double[] cusps, double[] ascMc);

    /**
     * Releases files and native handles. The provider must not be used afterwards.
     */
    void close();
}
