package com.pharmaintel.service;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.dto.ForecastRequest;
import com.pharmaintel.engine.EngineSettings;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ForecastingServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC);

    private ForecastCache cache;
    private ForecastingService service;

    @BeforeEach
    void setUp() {
        cache = new ForecastCache();
        ReflectionTestUtils.setField(cache, "maxEntries", 100);
        service = new ForecastingService(new InventoryIntelligenceEngine(EngineSettings.defaults(), CLOCK), cache);
    }

    private static List<ConsumptionRecord> dailyRecords(String itemId, int days, double quantity) {
        List<ConsumptionRecord> records = new ArrayList<>();
        Instant last = Instant.parse("2024-03-31T08:00:00Z");
        for (int i = days - 1; i >= 0; i--) {
            records.add(ConsumptionRecord.builder()
                .itemId(itemId).timestamp(last.minus(i, ChronoUnit.DAYS)).quantityConsumed(quantity).build());
        }
        return records;
    }

    @Test
    void forecast_aggregatesRecordsAndCachesTheResult() {
        ForecastRequest request = ForecastRequest.builder()
            .itemId("AMOX-500")
            .granularity(Granularity.DAY)
            .horizonPeriods(14)
            .records(dailyRecords("AMOX-500", 40, 12))
            .build();

        ForecastResult first = service.forecast(request);
        ForecastResult second = service.forecast(request);

        assertThat(first.getPredictedQuantityPerPeriod()).isCloseTo(12.0, within(1e-6));
        assertThat(second).isSameAs(first);
        assertThat(cache.stats().getMisses()).isEqualTo(1);
        assertThat(cache.stats().getHits()).isEqualTo(1);
    }
}
