package in.co.kundli.services;

import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.RawPosition;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Table of how each tracked body is obtained from the provider.
 *
 * <p>Every body maps to (source body, longitude offset, speed sign). The provider is asked for the
 * source body and the result is shifted and sign-adjusted uniformly. All bodies are identity rules
 * except Ketu, which is Rahu shifted by 180° with its speed negated.</p>
 */
public final class BodyDerivation {

    public static final class Rule {
        public final Planet source;
        public final double longitudeOffset;
        public final int speedSign;

        Rule(Planet source, double longitudeOffset, int speedSign) {
            this.source = source;
            this.longitudeOffset = longitudeOffset;
            this.speedSign = speedSign;
        }

        public boolean isIdentity() {
            return longitudeOffset == 0.0 && speedSign == 1;
        }
    }

    private static final Map<Planet, Rule> TABLE;

    static {
        Map<Planet, Rule> table = new EnumMap<>(Planet.class);
        for (Planet planet : Planet.values()) {
            table.put(planet, new Rule(planet, 0.0, 1));
        }
        table.put(Planet.KETU, new Rule(Planet.RAHU, EngineConfig.KETU_OFFSET, -1));
        TABLE = Collections.unmodifiableMap(table);
    }

    private BodyDerivation() {}

    public static Rule ruleFor(Planet planet) {
        return TABLE.get(planet);
    }

    public static Map<Planet, Rule> table() {
        return TABLE;
    }

    /**
     * Applies the body's rule to the raw values the provider returned for its source body.
     */
    public static RawPosition derive(Planet planet, double rawLongitude, double latitude,
                                     double distance, double rawSpeed) {
        Rule rule = TABLE.get(planet);
        double longitude = CoordinateClassifier.normalize(rawLongitude + rule.longitudeOffset);
        double speed = rule.speedSign * rawSpeed;
        return new RawPosition(planet, longitude, latitude, distance, speed);
    }
}
