package com.pharmaintel.service;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.ReorderSuggestion;
import com.pharmaintel.domain.SupplierQuote;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.dto.BatchRunRequest;
import com.pharmaintel.dto.BatchRunResponse;
import com.pharmaintel.dto.ItemRunResult;
import com.pharmaintel.dto.ItemRunStatus;
import com.pharmaintel.engine.EngineSettings;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import com.pharmaintel.engine.ReorderOptimizer;
import com.pharmaintel.exception.BatchSizeExceededException;
import com.pharmaintel.exception.ComputationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryRunServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ForecastingService forecastingService;

    private InventoryRunService service;

    @BeforeEach
    void setUp() {
        service = new InventoryRunService(new InventoryIntelligenceEngine(EngineSettings.defaults(), CLOCK),
            forecastingService, CLOCK);
        ReflectionTestUtils.setField(service, "maxItems", 10);
        ReflectionTestUtils.setField(service, "fallbackSafetyFactor", 1.5);
        ReflectionTestUtils.setField(service, "fallbackCoverDays", 30);
    }

    private static List<ConsumptionRecord> daily(String itemId, int days, double quantity) {
        List<ConsumptionRecord> records = new ArrayList<>();
        Instant last = Instant.parse("2024-03-31T09:00:00Z");
        for (int i = days - 1; i >= 0; i--) {
            records.add(ConsumptionRecord.builder()
                .itemId(itemId).timestamp(last.minus(i, ChronoUnit.DAYS)).quantityConsumed(quantity).build());
        }
        return records;
    }

    private static InventoryState batch(String itemId, double onHand) {
        return InventoryState.builder()
            .itemId(itemId)
            .batchId(itemId + "-B1")
            .quantityOnHand(onHand)
            .unitCost(2.0)
            .leadTimeDays(7)
            .expiryDate(LocalDate.of(2024, 4, 20))
            .build();
    }

    private static ForecastResult flatForecast(String itemId, double perDay) {
        return ForecastResult.builder()
            .itemId(itemId)
            .modelName("stub")
            .granularity(Granularity.DAY)
            .predictedQuantityPerPeriod(perDay)
            .forecastStdDev(0.0)
            .build();
    }

    private BatchRunRequest mixedRequest() {
        List<ConsumptionRecord> records = new ArrayList<>(daily("AMOX", 31, 10));
        records.addAll(daily("IBU", 31, 5));
        records.add(ConsumptionRecord.builder()
            .itemId("PARA").timestamp(Instant.parse("2024-03-30T10:00:00Z")).quantityConsumed(20).build());
        return BatchRunRequest.builder()
            .horizonPeriods(14)
            .records(records)
            .inventory(List.of(batch("AMOX", 30), batch("IBU", 500), batch("PARA", 5)))
            .suppliers(List.of(SupplierQuote.builder().supplierId("S1").itemId("AMOX").unitCost(1.5).build()))
            .build();
    }

    @Test
    void run_isolatesFailuresPerItem() {
        when(forecastingService.forecast(eq("AMOX"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("AMOX", 10));
        when(forecastingService.forecast(eq("IBU"), any(TimeSeries.class), eq(14)))
            .thenThrow(new ComputationException("boom"));

        BatchRunResponse response = service.run(mixedRequest());

        assertThat(response.getItems()).extracting(ItemRunResult::getItemId).containsExactly("AMOX", "IBU", "PARA");
        assertThat(response.getItems()).extracting(ItemRunResult::getStatus)
            .containsExactly(ItemRunStatus.OK, ItemRunStatus.FAILED, ItemRunStatus.INSUFFICIENT_DATA);

        BatchRunResponse.Summary summary = response.getSummary();
        assertThat(summary.getItems()).isEqualTo(3);
        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getInsufficientData()).isEqualTo(1);
        assertThat(summary.getReorders()).isEqualTo(2);
        assertThat(response.getGeneratedAt()).isEqualTo(CLOCK.instant());

        verify(forecastingService, never()).forecast(eq("PARA"), any(TimeSeries.class), anyInt());
    }

    @Test
    void run_okItemCarriesReorderAndExpiryScores() {
        when(forecastingService.forecast(eq("AMOX"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("AMOX", 10));
        when(forecastingService.forecast(eq("IBU"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("IBU", 5));

        ItemRunResult amox = service.run(mixedRequest()).getItems().get(0);

        ReorderSuggestion reorder = amox.getReorder();
        assertThat(reorder.getSupplierId()).isEqualTo("S1");
        assertThat(reorder.getReorderPoint()).isEqualTo(70.0);
        assertThat(reorder.getSuggestedQuantity()).isEqualTo(270.0);
        assertThat(reorder.getRationaleTags()).contains(ReorderOptimizer.TAG_BELOW_REORDER_POINT);
        assertThat(amox.getExpiryRisks()).hasSize(1);
        assertThat(amox.getAnomalies()).isEmpty();
    }

    @Test
    void run_reportsProgressPerItem() {
        when(forecastingService.forecast(eq("AMOX"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("AMOX", 10));
        when(forecastingService.forecast(eq("IBU"), any(TimeSeries.class), eq(14)))
            .thenThrow(new ComputationException("boom"));
        List<String> reported = new ArrayList<>();

        service.run(mixedRequest(), (processed, total) -> reported.add(processed + "/" + total));

        assertThat(reported).containsExactly("1/3", "2/3", "3/3");
    }

    @Test
    void run_failedItemKeepsItsErrorCode() {
        when(forecastingService.forecast(eq("AMOX"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("AMOX", 10));
        when(forecastingService.forecast(eq("IBU"), any(TimeSeries.class), eq(14)))
            .thenThrow(new ComputationException("boom"));

        ItemRunResult ibu = service.run(mixedRequest()).getItems().get(1);

        assertThat(ibu.getErrorCode()).isEqualTo("COMPUTATION_ERROR");
        assertThat(ibu.getMessage()).isEqualTo("boom");
        assertThat(ibu.getReorder()).isNull();
    }

    @Test
    void run_shortHistoryFallsBackToNaiveReorder() {
        when(forecastingService.forecast(eq("AMOX"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("AMOX", 10));
        when(forecastingService.forecast(eq("IBU"), any(TimeSeries.class), eq(14)))
            .thenReturn(flatForecast("IBU", 5));

        ItemRunResult para = service.run(mixedRequest()).getItems().get(2);

        assertThat(para.getErrorCode()).isEqualTo("INSUFFICIENT_DATA");
        ReorderSuggestion reorder = para.getReorder();
        assertThat(reorder.getSupplierId()).isEqualTo(ReorderSuggestion.NO_SUPPLIER);
        assertThat(reorder.getSuggestedQuantity()).isEqualTo(295.0);
        assertThat(reorder.getRationaleTags())
            .containsExactly(InventoryRunService.TAG_NAIVE_FALLBACK, ReorderOptimizer.TAG_MISSING_SUPPLIER);
    }

    @Test
    void naiveReorder_skipsWellStockedItems() {
        List<ConsumptionRecord> records = daily("PARA", 2, 10);

        assertThat(service.naiveReorder("PARA", records, batch("PARA", 200), List.of())).isEmpty();
        assertThat(service.naiveReorder("PARA", List.of(), batch("PARA", 0), List.of())).isEmpty();
    }

    @Test
    void run_rejectsTooManyItems() {
        ReflectionTestUtils.setField(service, "maxItems", 2);

        assertThatThrownBy(() -> service.run(mixedRequest()))
            .isInstanceOf(BatchSizeExceededException.class);
        verify(forecastingService, never()).forecast(any(String.class), any(TimeSeries.class), anyInt());
    }
}
