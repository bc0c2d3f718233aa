package com.pharmaintel.service;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.engine.EngineSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ForecastCacheTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private ForecastCache cache;
    private final AtomicInteger computations = new AtomicInteger();

    @BeforeEach
    void setUp() {
        cache = new ForecastCache();
        ReflectionTestUtils.setField(cache, "maxEntries", 2);
    }

    private ForecastResult compute(String itemId) {
        computations.incrementAndGet();
        return ForecastResult.builder().itemId(itemId).granularity(Granularity.DAY).modelName("stub").build();
    }

    private ForecastResult lookup(String itemId, int horizon, double... values) {
        TimeSeries series = TimeSeries.of(itemId, Granularity.DAY, START, values);
        return cache.getOrCompute(itemId, series, horizon, EngineSettings.defaults(), () -> compute(itemId));
    }

    @Test
    void getOrCompute_reusesResultForIdenticalInputs() {
        ForecastResult first = lookup("A", 7, 1, 2, 3);
        ForecastResult second = lookup("A", 7, 1, 2, 3);

        assertThat(second).isSameAs(first);
        assertThat(computations).hasValue(1);
        assertThat(cache.stats().getHits()).isEqualTo(1);
        assertThat(cache.stats().getMisses()).isEqualTo(1);
    }

    @Test
    void getOrCompute_changedDataOrHorizonIsAMiss() {
        lookup("A", 7, 1, 2, 3);
        lookup("A", 7, 1, 2, 4);
        lookup("A", 8, 1, 2, 3);

        assertThat(computations).hasValue(3);
    }

    @Test
    void getOrCompute_changedSettingsIsAMiss() {
        TimeSeries series = TimeSeries.of("A", Granularity.DAY, START, 1, 2, 3);
        EngineSettings stricter = EngineSettings.defaults().toBuilder().serviceLevel(0.99).build();

        cache.getOrCompute("A", series, 7, EngineSettings.defaults(), () -> compute("A"));
        cache.getOrCompute("A", series, 7, stricter, () -> compute("A"));

        assertThat(computations).hasValue(2);
    }

    @Test
    void getOrCompute_evictsOldestBeyondCapacity() {
        lookup("A", 7, 1, 2, 3);
        lookup("B", 7, 1, 2, 3);
        lookup("C", 7, 1, 2, 3);

        assertThat(cache.stats().getEntries()).isEqualTo(2);
        lookup("C", 7, 1, 2, 3);
        lookup("A", 7, 1, 2, 3);
        assertThat(computations).hasValue(4);
    }

    @Test
    void invalidate_dropsOnlyThatItem() {
        lookup("A", 7, 1, 2, 3);
        lookup("B", 7, 1, 2, 3);

        assertThat(cache.invalidate("A")).isEqualTo(1);
        assertThat(cache.stats().getEntries()).isEqualTo(1);

        cache.clear();
        assertThat(cache.stats().getEntries()).isZero();
    }
}
