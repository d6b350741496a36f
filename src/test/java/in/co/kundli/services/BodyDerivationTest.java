package in.co.kundli.services;

import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.RawPosition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BodyDerivationTest {

    private static final double DELTA = 1e-9;

    @Test
    public void test_everyBodyHasARule() {
        for (Planet planet : Planet.values()) {
            assertNotNull(BodyDerivation.ruleFor(planet), planet.name());
        }
        assertEquals(Planet.values().length, BodyDerivation.table().size());
    }

    @Test
    public void test_onlyKetuIsDerived() {
        for (Planet planet : Planet.values()) {
            BodyDerivation.Rule rule = BodyDerivation.ruleFor(planet);
            if (planet == Planet.KETU) {
                assertFalse(rule.isIdentity());
                assertEquals(Planet.RAHU, rule.source);
                assertEquals(180.0, rule.longitudeOffset, DELTA);
                assertEquals(-1, rule.speedSign);
            } else {
                assertTrue(rule.isIdentity(), planet.name());
                assertEquals(planet, rule.source);
            }
        }
    }

    @Test
    public void test_ketuDerivation_wrapsPast360AndNegatesSpeed() {
        RawPosition ketu = BodyDerivation.derive(Planet.KETU, 250.0, 0.0, 0.0025, -0.053);

        assertEquals(Planet.KETU, ketu.planet);
        assertEquals(70.0, ketu.longitude, DELTA);
        assertEquals(0.053, ketu.speed, DELTA);
        assertEquals(0.0025, ketu.distance, DELTA);
    }

    @Test
    public void test_identityDerivation_normalizesOnly() {
        RawPosition sun = BodyDerivation.derive(Planet.SUN, -10.0, 0.0001, 1.01, 0.98);

        assertEquals(350.0, sun.longitude, DELTA);
        assertEquals(0.98, sun.speed, DELTA);
        assertEquals(0.0001, sun.latitude, DELTA);
    }

    @Test
    public void test_ketuExactlyOppositeRahuAtZero() {
        assertEquals(180.0, BodyDerivation.derive(Planet.KETU, 0.0, 0.0, 0.0, 0.0).longitude, DELTA);
        assertEquals(0.0, BodyDerivation.derive(Planet.KETU, 180.0, 0.0, 0.0, 0.0).longitude, DELTA);
    }
}
