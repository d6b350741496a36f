package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import in.co.kundli.pojos.BirthMoment;
import in.co.kundli.pojos.VedicChart;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Transit charts: the sky over a place at local noon of a given date.
 *
 * <p>Results are cached per (date, latitude, longitude, timezone). Once the cache grows past
 * {@link EngineConfig#MAX_TRANSIT_CACHE_SIZE} entries, charts for dates more than
 * {@link EngineConfig#TRANSIT_CACHE_RETENTION_DAYS} days in the past are evicted. If that is not enough,
 * the entries with the oldest dates go next until the cache is back at its limit; the entry that
 * triggered the cleanup is kept.</p>
 */
public class TransitChartService {

    private final ChartAssembler chartAssembler;
    private final Clock clock;
    private final ConcurrentHashMap<TransitKey, VedicChart> transitCache = new ConcurrentHashMap<>();

    public TransitChartService(ChartAssembler chartAssembler) {
        this(chartAssembler, Clock.systemDefaultZone());
    }

    public TransitChartService(ChartAssembler chartAssembler, Clock clock) {
        this.chartAssembler = chartAssembler;
        this.clock = clock;
    }

    private static final class TransitKey {
        private final LocalDate date;
        private final double latitude;
        private final double longitude;
        private final String timezone;

        TransitKey(LocalDate date, double latitude, double longitude, String timezone) {
            this.date = date;
            this.latitude = latitude;
            this.longitude = longitude;
            this.timezone = timezone;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TransitKey)) return false;
            TransitKey that = (TransitKey) o;
            return Double.compare(that.latitude, latitude) == 0
                    && Double.compare(that.longitude, longitude) == 0
                    && date.equals(that.date)
                    && timezone.equals(that.timezone);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, latitude, longitude, timezone);
        }
    }

    public VedicChart getTransitChart(LocalDate date, double latitude, double longitude, String timezone) {
        if (date == null) {
            throw new ValidationException("Transit date is required");
        }
        BirthMoment moment = new BirthMoment("Transit", LocalDateTime.of(date, LocalTime.of(EngineConfig.TRANSIT_HOUR, 0)),
                latitude, longitude, timezone, null);
        TransitKey key = new TransitKey(date, latitude, longitude, moment.getTimezone());

        VedicChart cached = transitCache.get(key);
        if (cached != null) {
            LoggingService.debug("transit_cache_hit", Map.of("date", date.toString()));
            return cached;
        }

        VedicChart chart = chartAssembler.calculateChart(moment);
        VedicChart existing = transitCache.putIfAbsent(key, chart);
        cleanupCacheIfNeeded(key);
        return existing != null ? existing : chart;
    }

    /**
     * Transit chart for the place of a natal chart.
     */
    public VedicChart getTransitChart(VedicChart natalChart, LocalDate date) {
        BirthMoment natal = natalChart.getBirthMoment();
        return getTransitChart(date, natal.getLatitude(), natal.getLongitude(), natal.getTimezone());
    }

    /**
     * Computes the transit charts for several dates in parallel on {@code executor}, returned in the order
     * of {@code dates}. The first failure is rethrown once every task has finished.
     */
    public List<VedicChart> getTransitCharts(VedicChart natalChart, List<LocalDate> dates, Executor executor) {
        List<CompletableFuture<VedicChart>> futures = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            futures.add(CompletableFuture.supplyAsync(() -> getTransitChart(natalChart, date), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        List<VedicChart> charts = new ArrayList<>(futures.size());
        for (CompletableFuture<VedicChart> future : futures) {
            charts.add(future.join());
        }
        return charts;
    }

    public int getCacheSize() {
        return transitCache.size();
    }

    public void clearCache() {
        transitCache.clear();
    }

    private void cleanupCacheIfNeeded(TransitKey justAdded) {
        if (transitCache.size() <= EngineConfig.MAX_TRANSIT_CACHE_SIZE) {
            return;
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(EngineConfig.TRANSIT_CACHE_RETENTION_DAYS);
        int before = transitCache.size();
        transitCache.keySet().removeIf(key -> key.date.isBefore(cutoff) && !key.equals(justAdded));

        if (transitCache.size() > EngineConfig.MAX_TRANSIT_CACHE_SIZE) {
            List<TransitKey> oldestFirst = new ArrayList<>(transitCache.keySet());
            oldestFirst.remove(justAdded);
            oldestFirst.sort(Comparator.comparing((TransitKey key) -> key.date));
            Iterator<TransitKey> keys = oldestFirst.iterator();
            while (transitCache.size() > EngineConfig.MAX_TRANSIT_CACHE_SIZE && keys.hasNext()) {
                transitCache.remove(keys.next());
            }
        }
        LoggingService.debug("transit_cache_cleaned", Map.of(
                "before", before,
                "after", transitCache.size()));
    }

    static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return e;
    }
}
