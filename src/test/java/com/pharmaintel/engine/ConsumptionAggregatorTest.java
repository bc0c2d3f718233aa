package com.pharmaintel.engine;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.SeriesPoint;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.exception.InsufficientDataException;
import com.pharmaintel.exception.InvalidEngineInputException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumptionAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

    private final ConsumptionAggregator aggregator = new ConsumptionAggregator(EngineSettings.defaults(), CLOCK);

    private static ConsumptionRecord record(String itemId, String timestamp, double quantity) {
        return ConsumptionRecord.builder()
            .itemId(itemId)
            .timestamp(Instant.parse(timestamp))
            .quantityConsumed(quantity)
            .build();
    }

    @Test
    void aggregate_sumsSamePeriodAndFillsGapsUpToToday() {
        TimeSeries series = aggregator.aggregate("AMOX-500", List.of(
            record("AMOX-500", "2024-03-01T08:00:00Z", 5),
            record("AMOX-500", "2024-03-01T17:30:00Z", 3),
            record("AMOX-500", "2024-03-04T09:00:00Z", 2)), Granularity.DAY);

        assertThat(series.size()).isEqualTo(10);
        assertThat(series.firstPeriod()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(series.lastPeriod()).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(series.values()).containsExactly(8, 0, 0, 2, 0, 0, 0, 0, 0, 0);
        assertThat(series.isContiguous()).isTrue();
    }

    @Test
    void aggregate_weeklyBucketsStartOnMonday() {
        TimeSeries series = aggregator.aggregate("AMOX-500", List.of(
            record("AMOX-500", "2024-02-14T10:00:00Z", 4),
            record("AMOX-500", "2024-02-18T10:00:00Z", 6),
            record("AMOX-500", "2024-03-01T10:00:00Z", 1)), Granularity.WEEK);

        assertThat(series.getPoints()).extracting(SeriesPoint::period).containsExactly(
            LocalDate.of(2024, 2, 12), LocalDate.of(2024, 2, 19),
            LocalDate.of(2024, 2, 26), LocalDate.of(2024, 3, 4));
        assertThat(series.values()).containsExactly(10, 0, 1, 0);
    }

    @Test
    void aggregate_tooFewPeriodsIsInsufficientData() {
        ConsumptionAggregator early = new ConsumptionAggregator(EngineSettings.defaults(),
            Clock.fixed(Instant.parse("2024-03-02T00:00:00Z"), ZoneOffset.UTC));

        assertThatThrownBy(() -> early.aggregate("AMOX-500",
                List.of(record("AMOX-500", "2024-03-01T10:00:00Z", 4)), Granularity.DAY))
            .isInstanceOf(InsufficientDataException.class)
            .satisfies(ex -> {
                InsufficientDataException ide = (InsufficientDataException) ex;
                assertThat(ide.getAvailablePeriods()).isEqualTo(2);
                assertThat(ide.getRequiredPeriods()).isEqualTo(3);
                assertThat(ide.getErrorCode()).isEqualTo("INSUFFICIENT_DATA");
            });
    }

    @Test
    void aggregate_noRecordsIsInsufficientData() {
        assertThatThrownBy(() -> aggregator.aggregate("AMOX-500", List.of(), Granularity.DAY))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void aggregate_rejectsRecordsOfAnotherItem() {
        assertThatThrownBy(() -> aggregator.aggregate("AMOX-500", List.of(
                record("AMOX-500", "2024-03-01T10:00:00Z", 4),
                record("PARA-500", "2024-03-02T10:00:00Z", 4)), Granularity.DAY))
            .isInstanceOf(InvalidEngineInputException.class)
            .hasMessageContaining("PARA-500");
    }

    @Test
    void groupByItem_splitsMixedLogInItemOrder() {
        Map<String, List<ConsumptionRecord>> grouped = aggregator.groupByItem(List.of(
            record("PARA-500", "2024-03-01T10:00:00Z", 1),
            record("AMOX-500", "2024-03-01T10:00:00Z", 2),
            record("PARA-500", "2024-03-02T10:00:00Z", 3)));

        assertThat(grouped.keySet()).containsExactly("AMOX-500", "PARA-500");
        assertThat(grouped.get("PARA-500")).hasSize(2);
    }
}
