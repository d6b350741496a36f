package in.co.kundli.pojos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Twelve house cusps plus ascendant and midheaven for one house system.
 * The cusp array is copied in and never handed out, so instances are safe to share.
 */
public final class ChartCusps {

    private final HouseSystem houseSystem;
    private final double[] cusps;
    private final double ascendant;
    private final double midheaven;

    public ChartCusps(HouseSystem houseSystem, double[] cusps, double ascendant, double midheaven) {
        if (cusps == null || cusps.length != 12) {
            throw new IllegalArgumentException("Exactly 12 house cusps are required");
        }
        this.houseSystem = houseSystem;
        this.cusps = cusps.clone();
        this.ascendant = ascendant;
        this.midheaven = midheaven;
    }

    public HouseSystem getHouseSystem() {
        return houseSystem;
    }

    /**
     * Cusp longitude of the given house (1-12).
     */
    public double cusp(int house) {
        if (house < 1 || house > 12) {
            throw new IllegalArgumentException("House must be between 1 and 12, got: " + house);
        }
        return cusps[house - 1];
    }

    public List<Double> getCusps() {
        List<Double> list = new ArrayList<>(12);
        for (double cusp : cusps) {
            list.add(cusp);
        }
        return Collections.unmodifiableList(list);
    }

    public double[] toArray() {
        return cusps.clone();
    }

    public double getAscendant() {
        return ascendant;
    }

    public double getMidheaven() {
        return midheaven;
    }
}
