package com.pharmaintel.service;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.SeriesPoint;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.dto.CacheStatsResponse;
import com.pharmaintel.engine.EngineSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

// Keyed on the exact series content, so changed data never hits a stale entry.
@Slf4j
@Component
public class ForecastCache {

    @Value("${cache.forecast.max-entries:5000}")
    private int maxEntries;

    private final ConcurrentHashMap<Key, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ForecastResult getOrCompute(String itemId, TimeSeries series, int horizonPeriods, EngineSettings settings,
                                       Supplier<ForecastResult> compute) {
        Key key = Key.of(itemId, series, horizonPeriods, settings);
        Entry cached = entries.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached.result();
        }
        misses.incrementAndGet();
        ForecastResult result = compute.get();
        entries.put(key, new Entry(result, sequence.incrementAndGet()));
        cleanupIfNeeded();
        return result;
    }

    public int invalidate(String itemId) {
        int before = entries.size();
        entries.keySet().removeIf(k -> k.itemId().equals(itemId));
        int removed = before - entries.size();
        log.info("Forecast cache invalidated | itemId={} | removed={}", itemId, removed);
        return removed;
    }

    public void clear() {
        entries.clear();
        log.info("Forecast cache cleared");
    }

    public CacheStatsResponse stats() {
        return CacheStatsResponse.builder()
            .entries(entries.size())
            .maxEntries(maxEntries)
            .hits(hits.get())
            .misses(misses.get())
            .build();
    }

    private void cleanupIfNeeded() {
        if (entries.size() <= maxEntries) {
            return;
        }
        entries.entrySet().stream()
            .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
            .limit(Math.max(1, entries.size() - maxEntries))
            .map(Map.Entry::getKey)
            .toList()
            .forEach(entries::remove);
    }

    private record Entry(ForecastResult result, long sequence) {}

    private record Key(String itemId, Granularity granularity, LocalDate firstPeriod, List<Double> values,
                       int horizonPeriods, EngineSettings settings) {

        private static Key of(String itemId, TimeSeries series, int horizonPeriods, EngineSettings settings) {
            List<Double> values = series.getPoints() == null ? List.of()
                : series.getPoints().stream().map(SeriesPoint::quantity).toList();
            return new Key(String.valueOf(itemId), series.getGranularity(),
                series.size() == 0 ? null : series.firstPeriod(), values, horizonPeriods, settings);
        }
    }
}
