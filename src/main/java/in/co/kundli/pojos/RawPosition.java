package in.co.kundli.pojos;

/**
 * Unclassified provider output for one body, after the body-derivation rule has been applied.
 */
public final class RawPosition {

    public final Planet planet;
    public final double longitude;
    public final double latitude;
    public final double distance;
    public final double speed;

    public RawPosition(Planet planet, double longitude, double latitude, double distance, double speed) {
        this.planet = planet;
        this.longitude = longitude;
        this.latitude = latitude;
        this.distance = distance;
        this.speed = speed;
    }

    @Override
    public String toString() {
        return "RawPosition{" + planet + ", lon=" + longitude + ", lat=" + latitude
                + ", dist=" + distance + ", speed=" + speed + "}";
    }
}
