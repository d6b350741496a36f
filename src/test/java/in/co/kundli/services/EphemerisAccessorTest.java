package in.co.kundli.services;

import in.co.kundli.exceptions.CalculationException;
import in.co.kundli.exceptions.ClosedStateException;
import in.co.kundli.exceptions.InitializationException;
import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.AyanamsaType;
import in.co.kundli.pojos.ChartCusps;
import in.co.kundli.pojos.HouseSystem;
import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.RawPosition;
import in.co.kundli.provider.EphemerisProvider;
import in.co.kundli.provider.FakeEphemerisProvider;
import in.co.kundli.provider.ProviderConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class EphemerisAccessorTest {

    private static final double DELTA = 1e-9;
    private static final double JD = 2448026.8645833335;

    @Mock
    private EphemerisProvider mockProvider;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Test
    public void test_createWithoutDataPath_usesBuiltInModeAndConfiguresProvider() {
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.RAMAN, null);

        assertFalse(accessor.isUsingHighPrecisionEphemeris());
        assertEquals(AyanamsaType.RAMAN, accessor.getAyanamsaType());
        verify(mockProvider).setEphemerisPath(null);
        verify(mockProvider).setSiderealMode(ProviderConstants.SIDM_RAMAN);
    }

    @Test
    public void test_createWithNullAyanamsa_defaultsToLahiri() {
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, null, null);
        assertEquals(AyanamsaType.LAHIRI, accessor.getAyanamsaType());
    }

    @Test
    public void test_directoryWithSwissFiles_enablesHighPrecision() throws IOException {
        Files.createFile(tempDir.resolve("sepl_18.se1"));
        FakeEphemerisProvider provider = new FakeEphemerisProvider();

        EphemerisAccessor accessor = EphemerisAccessor.create(provider, AyanamsaType.LAHIRI, tempDir.toFile());
        accessor.position(Planet.SUN, JD);

        assertTrue(accessor.isUsingHighPrecisionEphemeris());
        assertEquals(tempDir.toFile().getAbsolutePath(), provider.getEphemerisPath());
        assertEquals(ProviderConstants.FLAG_HIGH_PRECISION,
                provider.getLastFlags() & ProviderConstants.FLAG_HIGH_PRECISION);
    }

    @Test
    public void test_directoryWithJplFile_enablesHighPrecision() throws IOException {
        Files.createFile(tempDir.resolve("de440.eph"));
        assertTrue(EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, tempDir.toFile())
                .isUsingHighPrecisionEphemeris());
    }

    @Test
    public void test_directoryWithoutDataFiles_degradesToBuiltInMode() throws IOException {
        Files.createFile(tempDir.resolve("notes.txt"));
        FakeEphemerisProvider provider = new FakeEphemerisProvider();

        EphemerisAccessor accessor = EphemerisAccessor.create(provider, AyanamsaType.LAHIRI, tempDir.toFile());
        accessor.position(Planet.SUN, JD);

        assertFalse(accessor.isUsingHighPrecisionEphemeris());
        assertEquals(0, provider.getLastFlags() & ProviderConstants.FLAG_HIGH_PRECISION);
        assertEquals(ProviderConstants.FLAG_SIDEREAL | ProviderConstants.FLAG_SPEED, provider.getLastFlags());
    }

    @Test
    public void test_missingDirectory_isCreated() {
        File dir = tempDir.resolve("ephe").resolve("nested").toFile();

        EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, dir);

        assertTrue(dir.isDirectory());
    }

    @Test
    public void test_pathIsAFile_throwsInitializationException() throws IOException {
        File file = Files.createFile(tempDir.resolve("not-a-dir")).toFile();
        assertThrows(InitializationException.class,
                () -> EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, file));
    }

    @Test
    public void test_providerRejectsConfiguration_closesProviderAndThrows() {
        doThrow(new IllegalStateException("bad mode")).when(mockProvider).setSiderealMode(anyInt());

        assertThrows(InitializationException.class,
                () -> EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null));
        verify(mockProvider).close();
    }

    @Test
    public void test_close_isIdempotentAndReleasesProviderOnce() {
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        accessor.close();
        accessor.close();

        assertTrue(accessor.isClosed());
        verify(mockProvider, times(1)).close();
    }

    @Test
    public void test_providerCloseFailure_stillTransitionsToClosed() {
        doThrow(new RuntimeException("handle already freed")).when(mockProvider).close();
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        accessor.close();

        assertTrue(accessor.isClosed());
    }

    @Test
    public void test_callsAfterClose_throwClosedStateException() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);
        accessor.close();

        assertThrows(ClosedStateException.class, () -> accessor.position(Planet.SUN, JD));
        assertThrows(ClosedStateException.class, () -> accessor.ayanamsa(JD));
        assertThrows(ClosedStateException.class, () -> accessor.calculateExclusively(session -> 1));
        assertThrows(ClosedStateException.class, accessor::currentAyanamsa);
    }

    // =========================================================================
    // Positions
    // =========================================================================

    @Test
    public void test_position_returnsProviderValues() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);

        RawPosition moon = accessor.position(Planet.MOON, JD);

        assertEquals(Planet.MOON, moon.planet);
        assertEquals(FakeEphemerisProvider.longitudeOf(ProviderConstants.MOON, JD), moon.longitude, DELTA);
        assertEquals(5.1, moon.latitude, DELTA);
        assertEquals(FakeEphemerisProvider.speedOf(ProviderConstants.MOON), moon.speed, DELTA);
    }

    @Test
    public void test_ketu_isRahuPlus180WithSpeedNegated() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);

        for (int i = 0; i < 50; i++) {
            double jd = 2415020.5 + i * 731.37;
            RawPosition rahu = accessor.position(Planet.RAHU, jd);
            RawPosition ketu = accessor.position(Planet.KETU, jd);

            assertEquals(CoordinateClassifier.normalize(rahu.longitude + 180.0), ketu.longitude, DELTA);
            assertEquals(-rahu.speed, ketu.speed, DELTA);
            assertTrue(rahu.speed < 0, "mean node moves backwards");
        }
    }

    @Test
    public void test_providerError_surfacesCalculationExceptionWithProviderText() {
        when(mockProvider.calculate(anyDouble(), eq(ProviderConstants.MARS), anyInt(), any(double[].class), any(StringBuilder.class)))
                .thenAnswer(invocation -> {
                    StringBuilder error = invocation.getArgument(4);
                    error.append("ephemeris file not found");
                    return ProviderConstants.ERR;
                });
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        CalculationException e = assertThrows(CalculationException.class, () -> accessor.position(Planet.MARS, JD));

        assertEquals("Mars", e.getBody());
        assertEquals(JD, e.getJulianDay(), DELTA);
        assertEquals("ephemeris file not found", e.getProviderMessage());
        assertTrue(e.getMessage().contains("ephemeris file not found"));
    }

    @Test
    public void test_providerErrorWithoutText_reportsErrorCode() {
        when(mockProvider.calculate(anyDouble(), anyInt(), anyInt(), any(double[].class), any(StringBuilder.class)))
                .thenReturn(-7);
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        CalculationException e = assertThrows(CalculationException.class, () -> accessor.position(Planet.SUN, JD));

        assertEquals("Unknown calculation error (code: -7)", e.getProviderMessage());
    }

    @Test
    public void test_buffersAreClearedBetweenCalls() {
        when(mockProvider.calculate(anyDouble(), anyInt(), anyInt(), any(double[].class), any(StringBuilder.class)))
                .thenAnswer(invocation -> {
                    double[] result = invocation.getArgument(3);
                    result[0] = 123.0;
                    result[3] = 1.5;
                    return ProviderConstants.OK;
                })
                .thenReturn(ProviderConstants.OK);
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        RawPosition first = accessor.position(Planet.SUN, JD);
        RawPosition second = accessor.position(Planet.SUN, JD + 1);

        assertEquals(123.0, first.longitude, DELTA);
        assertEquals(0.0, second.longitude, DELTA);
        assertEquals(0.0, second.speed, DELTA);
    }

    // =========================================================================
    // Sessions and ayanamsa
    // =========================================================================

    @Test
    public void test_sessionUsedAfterBlock_throws() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);
        AtomicReference<EphemerisAccessor.CalculationSession> leaked = new AtomicReference<>();

        accessor.calculateExclusively(session -> {
            leaked.set(session);
            return null;
        });

        assertThrows(IllegalStateException.class, () -> leaked.get().position(Planet.SUN, JD));
    }

    @Test
    public void test_sessionHouses_normalizesCusps() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);

        ChartCusps cusps = accessor.calculateExclusively(session -> session.houses(JD, 27.7, 85.3, HouseSystem.PLACIDUS));

        for (double cusp : cusps.toArray()) {
            assertTrue(cusp >= 0.0 && cusp < 360.0);
        }
    }

    @Test
    public void test_ayanamsaHelpers_agreeWithJulianDayLookup() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);
        LocalDateTime birth = LocalDateTime.of(1990, 5, 15, 14, 30);

        assertEquals(JD, accessor.julianDayFor(birth, "Asia/Kathmandu"), DELTA);
        assertEquals(FakeEphemerisProvider.rawAyanamsa(JD), accessor.ayanamsaFor(birth, "Asia/Kathmandu"), DELTA);
        assertEquals(accessor.ayanamsa(JD), accessor.ayanamsaFor(birth, "Asia/Kathmandu"), DELTA);
        assertTrue(accessor.currentAyanamsa() > FakeEphemerisProvider.rawAyanamsa(JD));
    }

    // =========================================================================
    // Input checks
    // =========================================================================

    @Test
    public void test_positionWithoutPlanet_throwsValidationException() {
        FakeEphemerisProvider provider = new FakeEphemerisProvider();
        EphemerisAccessor accessor = EphemerisAccessor.create(provider, AyanamsaType.LAHIRI, null);

        ValidationException e = assertThrows(ValidationException.class, () -> accessor.position(null, JD));

        assertEquals("Planet is required", e.getErrors().get(0));
        assertEquals(0, provider.getCalculateCalls());
    }

    @Test
    public void test_nonFiniteJulianDay_rejectedBeforeProvider() {
        EphemerisAccessor accessor = EphemerisAccessor.create(mockProvider, AyanamsaType.LAHIRI, null);

        assertThrows(ValidationException.class, () -> accessor.ayanamsa(Double.NaN));
        assertThrows(ValidationException.class, () -> accessor.position(Planet.SUN, Double.POSITIVE_INFINITY));
        assertThrows(ValidationException.class, () -> accessor.calculateExclusively(
                session -> session.houses(Double.NaN, 27.7, 85.3, HouseSystem.PLACIDUS)));
        assertThrows(ValidationException.class, () -> accessor.calculateExclusively(
                session -> session.ayanamsa(Double.NEGATIVE_INFINITY)));

        verify(mockProvider, never()).ayanamsa(anyDouble());
        verify(mockProvider, never()).calculate(anyDouble(), anyInt(), anyInt(), any(double[].class), any(StringBuilder.class));
        verify(mockProvider, never()).houses(anyDouble(), anyInt(), anyDouble(), anyDouble(), anyInt(),
                any(double[].class), any(double[].class));
    }

    @Test
    public void test_sessionHousesWithoutSystem_throwsValidationException() {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);

        assertThrows(ValidationException.class,
                () -> accessor.calculateExclusively(session -> session.houses(JD, 27.7, 85.3, null)));
    }

    // =========================================================================
    // Buffer release
    // =========================================================================

    @Test
    public void test_close_releasesBuffersOfEveryThread() throws Exception {
        EphemerisAccessor accessor = EphemerisAccessor.create(new FakeEphemerisProvider(), AyanamsaType.LAHIRI, null);
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            EphemerisAccessor.CalculationBuffers workerBuffers = worker.submit(() -> {
                accessor.position(Planet.MOON, JD);
                return accessor.buffersForCurrentThread();
            }).get(10, TimeUnit.SECONDS);
            accessor.position(Planet.SUN, JD);

            assertEquals(2, accessor.getLiveBufferCount());
            assertEquals(FakeEphemerisProvider.longitudeOf(ProviderConstants.MOON, JD), workerBuffers.planetResult[0], DELTA);

            accessor.close();

            assertEquals(0, accessor.getLiveBufferCount());
            for (double value : workerBuffers.planetResult) {
                assertEquals(0.0, value, 0.0);
            }
            assertNull(worker.submit(accessor::buffersForCurrentThread).get(10, TimeUnit.SECONDS));
            assertNull(accessor.buffersForCurrentThread());
        } finally {
            worker.shutdownNow();
        }
    }
}
