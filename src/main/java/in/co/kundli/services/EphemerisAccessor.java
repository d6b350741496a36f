package in.co.kundli.services;

import in.co.kundli.exceptions.CalculationException;
import in.co.kundli.exceptions.ClosedStateException;
import in.co.kundli.exceptions.InitializationException;
import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.AyanamsaType;
import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.ChartCusps;
import in.co.kundli.pojos.HouseSystem;
import in.co.kundli.pojos.Planet;
import in.co.kundli.pojos.RawPosition;
import in.co.kundli.provider.EphemerisProvider;
import in.co.kundli.provider.ProviderConstants;

import java.io.File;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Thread-safe owner of one {@link EphemerisProvider} handle.
 *
 * <h2>Locking</h2>
 * A full chart is a sequence of provider calls sharing the provider's configuration state, so it runs
 * inside {@link #calculateExclusively} under the write lock. Ayanamsa-only lookups take the read lock
 * and may run concurrently with each other.
 *
 * <h2>Scratch buffers</h2>
 * Every thread gets its own {@link CalculationBuffers}, created lazily and zeroed before each use.
 * Nothing read from a buffer leaves this class without being copied into an immutable value.
 * Closing zeroes and drops the buffers of every thread, not only the closing one.
 *
 * <h2>Lifecycle</h2>
 * Created once per session via {@link #create}; {@link #close()} is one-way. Any call after close fails
 * with {@link ClosedStateException}.
 */
public class EphemerisAccessor implements AutoCloseable {

    private static final int BASE_CALC_FLAGS = ProviderConstants.FLAG_SIDEREAL | ProviderConstants.FLAG_SPEED;

    private final EphemerisProvider provider;
    private final String ephemerisPath;
    private final AyanamsaType ayanamsaType;
    private final boolean highPrecision;
    private final int calculationFlags;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // every thread's buffers, so close() can release them all and not only the closing thread's
    private final Set<CalculationBuffers> allBuffers = ConcurrentHashMap.newKeySet();
    private volatile ThreadLocal<CalculationBuffers> threadLocalBuffers = ThreadLocal.withInitial(this::newBuffers);
    private volatile boolean closed = false;

    /**
     * Per-thread scratch space handed to the provider.
     */
    static final class CalculationBuffers {
        final double[] planetResult = new double[ProviderConstants.POSITION_RESULT_SIZE];
        final double[] houseCusps = new double[ProviderConstants.HOUSE_CUSPS_SIZE];
        final double[] ascMc = new double[ProviderConstants.ASC_MC_SIZE];
        final StringBuilder error = new StringBuilder(EngineConfig.ERROR_BUFFER_SIZE);

        void clear() {
            Arrays.fill(planetResult, 0.0);
            Arrays.fill(houseCusps, 0.0);
            Arrays.fill(ascMc, 0.0);
            error.setLength(0);
        }
    }

    private EphemerisAccessor(EphemerisProvider provider, String ephemerisPath, AyanamsaType ayanamsaType,
                              boolean highPrecision) {
        this.provider = provider;
        this.ephemerisPath = ephemerisPath;
        this.ayanamsaType = ayanamsaType;
        this.highPrecision = highPrecision;
        this.calculationFlags = highPrecision
                ? BASE_CALC_FLAGS | ProviderConstants.FLAG_HIGH_PRECISION
                : BASE_CALC_FLAGS;
    }

    /**
     * Opens an accessor over the given provider.
     *
     * @param provider      the numerical provider; owned by the accessor from now on
     * @param ayanamsaType  sidereal correction for every calculation of this session
     * @param ephemerisDir  directory of higher-precision data files, or {@code null} for built-in mode.
     *                      Created if missing. Without recognised data files the built-in mode is used.
     * @throws InitializationException if the directory cannot be created or the provider rejects its configuration
     */
    public static EphemerisAccessor create(EphemerisProvider provider, AyanamsaType ayanamsaType, File ephemerisDir) {
        if (provider == null) {
            throw new InitializationException("Ephemeris provider is required");
        }
        AyanamsaType ayanamsa = ayanamsaType == null ? EngineConfig.DEFAULT_AYANAMSA : ayanamsaType;

        String path = null;
        boolean highPrecision = false;
        if (ephemerisDir != null) {
            if (!ephemerisDir.exists() && !ephemerisDir.mkdirs()) {
                throw new InitializationException("Failed to create ephemeris directory: " + ephemerisDir.getAbsolutePath());
            }
            if (!ephemerisDir.isDirectory()) {
                throw new InitializationException("Ephemeris path is not a directory: " + ephemerisDir.getAbsolutePath());
            }
            path = ephemerisDir.getAbsolutePath();
            highPrecision = hasHighPrecisionEphemeris(ephemerisDir);
        }

        if (highPrecision) {
            LoggingService.info("ephemeris_high_precision_mode", Map.of("path", path));
        } else {
            LoggingService.info("ephemeris_builtin_mode",
                    Map.of("path", path == null ? "" : path, "reason", path == null ? "no_data_path" : "no_data_files"));
        }

        try {
            provider.setEphemerisPath(path);
            provider.setSiderealMode(ayanamsa.getSiderealMode());
        } catch (RuntimeException e) {
            try {
                provider.close();
            } catch (RuntimeException closeError) {
                e.addSuppressed(closeError);
                LoggingService.warn("ephemeris_provider_close_after_init_failure", closeError);
            }
            throw new InitializationException("Failed to initialize ephemeris provider", e);
        }

        EphemerisAccessor accessor = new EphemerisAccessor(provider, path, ayanamsa, highPrecision);
        LoggingService.info("ephemeris_engine_initialized", Map.of(
                "ayanamsa", ayanamsa.getDisplayName(),
                "highPrecision", highPrecision));
        return accessor;
    }

    private CalculationBuffers newBuffers() {
        CalculationBuffers buffers = new CalculationBuffers();
        allBuffers.add(buffers);
        return buffers;
    }

    /**
     * Buffers of the calling thread, or {@code null} once the accessor is closed.
     */
    CalculationBuffers buffersForCurrentThread() {
        ThreadLocal<CalculationBuffers> local = threadLocalBuffers;
        return local == null ? null : local.get();
    }

    int getLiveBufferCount() {
        return allBuffers.size();
    }

    private static boolean hasHighPrecisionEphemeris(File ephemerisDir) {
        File[] files = ephemerisDir.listFiles();
        if (files == null) {
            return false;
        }
        for (File file : files) {
            if (file.isFile() && EngineConfig.isHighPrecisionDataFile(file.getName())) {
                return true;
            }
        }
        return false;
    }

    public AyanamsaType getAyanamsaType() {
        return ayanamsaType;
    }

    public boolean isUsingHighPrecisionEphemeris() {
        return highPrecision;
    }

    public String getEphemerisPath() {
        return ephemerisPath;
    }

    public boolean isClosed() {
        return closed;
    }

    // =========================================================================
    // Exclusive (single writer) calculations
    // =========================================================================

    /**
     * Runs a multi-step calculation while holding the exclusive lock. The session handed to
     * {@code work} is only usable for the duration of the call.
     */
    public <T> T calculateExclusively(Function<CalculationSession, T> work) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            ensureOpen();
            CalculationBuffers buffers = threadLocalBuffers.get();
            buffers.clear();
            CalculationSession session = new CalculationSession(buffers);
            try {
                return work.apply(session);
            } finally {
                session.active = false;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Single body lookup. Takes the exclusive lock for the one provider call.
     */
    public RawPosition position(Planet planet, double julianDay) {
        return calculateExclusively(session -> session.position(planet, julianDay));
    }

    // =========================================================================
    // Shared (concurrent reader) lookups
    // =========================================================================

    public double ayanamsa(double julianDay) {
        TimeConverter.validateJulianDay(julianDay);
        ensureOpen();
        lock.readLock().lock();
        try {
            ensureOpen();
            return provider.ayanamsa(julianDay);
        } finally {
            lock.readLock().unlock();
        }
    }

    public double ayanamsaFor(LocalDateTime dateTime, String timezone) {
        return ayanamsa(TimeConverter.julianDay(dateTime, timezone));
    }

    public double currentAyanamsa() {
        return ayanamsa(TimeConverter.julianDay(LocalDateTime.now(ZoneOffset.UTC)));
    }

    public double julianDayFor(LocalDateTime dateTime, String timezone) {
        return TimeConverter.julianDay(dateTime, timezone);
    }

    /**
     * Provider access while the exclusive lock is held. Obtained only through {@link #calculateExclusively}.
     */
    public final class CalculationSession {

        private final CalculationBuffers buffers;
        private boolean active = true;

        private CalculationSession(CalculationBuffers buffers) {
            this.buffers = buffers;
        }

        public double ayanamsa(double julianDay) {
            checkActive();
            TimeConverter.validateJulianDay(julianDay);
            return provider.ayanamsa(julianDay);
        }

        /**
         * Position of one body, with the body-derivation rule applied.
         *
         * @throws ValidationException  for a missing body or a non-finite Julian Day
         * @throws CalculationException if the provider reports an error for the source body
         */
        public RawPosition position(Planet planet, double julianDay) {
            checkActive();
            if (planet == null) {
                throw new ValidationException("Planet is required");
            }
            TimeConverter.validateJulianDay(julianDay);
            BodyDerivation.Rule rule = BodyDerivation.ruleFor(planet);

            Arrays.fill(buffers.planetResult, 0.0);
            buffers.error.setLength(0);

            int code = provider.calculate(julianDay, rule.source.getProviderBodyId(), calculationFlags,
                    buffers.planetResult, buffers.error);
            if (code < 0) {
                String message = buffers.error.length() > 0
                        ? buffers.error.toString()
                        : "Unknown calculation error (code: " + code + ")";
                LoggingService.error("ephemeris_calculation_failed", Map.of(
                        "body", planet.getDisplayName(),
                        "julianDay", julianDay,
                        "code", code,
                        "providerMessage", message));
                throw new CalculationException(planet.getDisplayName(), julianDay, message);
            }

            return BodyDerivation.derive(planet,
                    buffers.planetResult[0],
                    buffers.planetResult[1],
                    buffers.planetResult[2],
                    buffers.planetResult[3]);
        }

        /**
         * Sidereal cusps and angles. A provider error code is logged and the values it produced are
         * still used, as the provider falls back to Porphyry internally in that case.
         */
        public ChartCusps houses(double julianDay, double latitude, double longitude, HouseSystem houseSystem) {
            checkActive();
            if (houseSystem == null) {
                throw new ValidationException("House system is required");
            }
            TimeConverter.validateJulianDay(julianDay);
            BirthMoment.validateCoordinates(latitude, longitude);
            Arrays.fill(buffers.houseCusps, 0.0);
            Arrays.fill(buffers.ascMc, 0.0);

            int code = provider.houses(julianDay, ProviderConstants.FLAG_SIDEREAL, latitude, longitude,
                    houseSystem.getCode(), buffers.houseCusps, buffers.ascMc);
            if (code < 0) {
                LoggingService.warn("house_calculation_provider_error", Map.of(
                        "houseSystem", houseSystem.getDisplayName(),
                        "latitude", latitude,
                        "code", code));
            }

            double[] cusps = new double[12];
            for (int house = 1; house <= 12; house++) {
                cusps[house - 1] = CoordinateClassifier.normalize(buffers.houseCusps[house]);
            }
            return new ChartCusps(houseSystem, cusps,
                    CoordinateClassifier.normalize(buffers.ascMc[ProviderConstants.ASC_INDEX]),
                    CoordinateClassifier.normalize(buffers.ascMc[ProviderConstants.MC_INDEX]));
        }

        private void checkActive() {
            if (!active) {
                throw new IllegalStateException("Calculation session used outside calculateExclusively");
            }
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new ClosedStateException("EphemerisAccessor has been closed and cannot be used");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            try {
                provider.close();
            } catch (RuntimeException e) {
                LoggingService.error("ephemeris_provider_close_failed", e);
            } finally {
                for (CalculationBuffers buffers : allBuffers) {
                    buffers.clear();
                }
                allBuffers.clear();
                threadLocalBuffers.remove();
                threadLocalBuffers = null;
                closed = true;
                LoggingService.info("ephemeris_engine_closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "EphemerisAccessor(ayanamsa=" + ayanamsaType.getDisplayName()
                + ", highPrecision=" + highPrecision
                + ", closed=" + closed + ")";
    }
}
