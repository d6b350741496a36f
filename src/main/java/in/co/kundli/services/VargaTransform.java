package in.co.kundli.services;

/**
 * Maps a sidereal longitude onto its position in one divisional chart.
 */
@FunctionalInterface
public interface VargaTransform {

    /**
     * @param longitude sidereal longitude, any finite value
     * @return divisional longitude in [0, 360)
     */
    double apply(double longitude);
}
