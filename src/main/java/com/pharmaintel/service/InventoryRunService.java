package com.pharmaintel.service;

import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.ConsumptionShift;
import com.pharmaintel.domain.ExpiryRiskScore;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.ReorderSuggestion;
import com.pharmaintel.domain.RiskLevel;
import com.pharmaintel.domain.SupplierQuote;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.dto.BatchRunRequest;
import com.pharmaintel.dto.BatchRunResponse;
import com.pharmaintel.dto.ItemRunResult;
import com.pharmaintel.dto.ItemRunStatus;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import com.pharmaintel.exception.BatchSizeExceededException;
import com.pharmaintel.exception.InsufficientDataException;
import com.pharmaintel.exception.InventoryIntelligenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

@Slf4j
@Service
public class InventoryRunService {

    public static final String TAG_NAIVE_FALLBACK = "naive_fallback";
    private static final double SHIFT_WINDOW_DAYS = 30.0;

    private final InventoryIntelligenceEngine engine;
    private final ForecastingService forecastingService;
    private final Clock clock;

    @Value("${runs.max-items:500}")
    private int maxItems;

    @Value("${runs.fallback.safety-factor:1.5}")
    private double fallbackSafetyFactor;

    @Value("${runs.fallback.cover-days:30}")
    private int fallbackCoverDays;

    public InventoryRunService(InventoryIntelligenceEngine engine, ForecastingService forecastingService, Clock clock) {
        this.engine = engine;
        this.forecastingService = forecastingService;
        this.clock = clock;
    }

    public BatchRunResponse run(BatchRunRequest request) {
        return run(request, RunProgressListener.NONE);
    }

    public BatchRunResponse run(BatchRunRequest request, RunProgressListener progress) {
        Map<String, List<ConsumptionRecord>> recordsByItem = engine.groupByItem(request.getRecords());
        Map<String, List<InventoryState>> batchesByItem = new TreeMap<>();
        for (InventoryState state : request.getInventory()) {
            batchesByItem.computeIfAbsent(state.getItemId(), id -> new ArrayList<>()).add(state);
        }
        TreeSet<String> itemIds = new TreeSet<>(batchesByItem.keySet());
        itemIds.addAll(recordsByItem.keySet());
        if (itemIds.size() > maxItems) {
            throw new BatchSizeExceededException(itemIds.size(), maxItems);
        }

        UUID runId = UUID.randomUUID();
        log.info("Run started | runId={} | items={} | granularity={} | horizon={}",
                 runId, itemIds.size(), request.getGranularity(), request.getHorizonPeriods());

        List<ItemRunResult> results = new ArrayList<>(itemIds.size());
        for (String itemId : itemIds) {
            results.add(runItem(itemId,
                recordsByItem.getOrDefault(itemId, List.of()),
                batchesByItem.getOrDefault(itemId, List.of()),
                suppliersFor(itemId, request.getSuppliers()),
                request.getGranularity(),
                request.getHorizonPeriods()));
            progress.itemProcessed(results.size(), itemIds.size());
        }

        BatchRunResponse.Summary summary = summarize(results);
        log.info("Run finished | runId={} | items={} | succeeded={} | insufficient={} | failed={} | reorders={}",
                 runId, summary.getItems(), summary.getSucceeded(), summary.getInsufficientData(),
                 summary.getFailed(), summary.getReorders());
        return BatchRunResponse.builder()
            .runId(runId)
            .generatedAt(clock.instant())
            .summary(summary)
            .items(List.copyOf(results))
            .build();
    }

    private ItemRunResult runItem(String itemId, List<ConsumptionRecord> records, List<InventoryState> batches,
                                  List<SupplierQuote> suppliers, Granularity granularity, int horizon) {
        try {
            TimeSeries series = engine.aggregate(itemId, records, granularity);
            ForecastResult forecast = forecastingService.forecast(itemId, series, horizon);
            List<AnomalyFlag> anomalies = engine.detectAnomalies(series);
            int shiftWindow = Math.max(1, (int) Math.round(SHIFT_WINDOW_DAYS / granularity.averageDays()));
            ConsumptionShift shift = engine.detectShift(series, shiftWindow).orElse(null);

            ReorderSuggestion reorder = null;
            List<ExpiryRiskScore> expiry = List.of();
            if (!batches.isEmpty()) {
                reorder = engine.recommendReorder(forecast, combine(itemId, batches), suppliers).orElse(null);
                expiry = engine.scoreExpiryRisks(forecast, batches);
            }
            return ItemRunResult.builder()
                .itemId(itemId)
                .status(ItemRunStatus.OK)
                .forecast(forecast)
                .anomalies(anomalies)
                .shift(shift)
                .reorder(reorder)
                .expiryRisks(expiry)
                .build();
        } catch (InsufficientDataException ex) {
            log.warn("Insufficient history, naive fallback | itemId={} | periods={} | required={}",
                     itemId, ex.getAvailablePeriods(), ex.getRequiredPeriods());
            return ItemRunResult.builder()
                .itemId(itemId)
                .status(ItemRunStatus.INSUFFICIENT_DATA)
                .reorder(batches.isEmpty() ? null : naiveReorder(itemId, records, combine(itemId, batches), suppliers).orElse(null))
                .errorCode(ex.getErrorCode())
                .message(ex.getMessage())
                .build();
        } catch (InventoryIntelligenceException ex) {
            log.warn("Item failed | itemId={} | code={} | reason={}", itemId, ex.getErrorCode(), ex.getMessage());
            return failed(itemId, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Item failed unexpectedly | itemId={}", itemId, ex);
            return failed(itemId, "INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    Optional<ReorderSuggestion> naiveReorder(String itemId, List<ConsumptionRecord> records, InventoryState position,
                                             List<SupplierQuote> suppliers) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock.withZone(engine.getSettings().getZone()));
        LocalDate first = records.stream()
            .map(r -> r.getTimestamp().atZone(engine.getSettings().getZone()).toLocalDate())
            .min(Comparator.naturalOrder())
            .orElse(today);
        long days = Math.max(1L, ChronoUnit.DAYS.between(first, today) + 1);
        double avgDaily = records.stream().mapToDouble(ConsumptionRecord::getQuantityConsumed).sum() / days;
        double onHand = position.getQuantityOnHand() + position.getQuantityInTransit();
        double threshold = avgDaily * position.getLeadTimeDays() * fallbackSafetyFactor;
        if (avgDaily <= 0.0 || onHand > threshold) {
            return Optional.empty();
        }
        double quantity = Math.ceil(Math.max(0.0, avgDaily * fallbackCoverDays - onHand));
        if (quantity <= 0.0) {
            return Optional.empty();
        }

        Optional<SupplierQuote> cheapest = suppliers.stream()
            .min(Comparator.comparingDouble(SupplierQuote::getUnitCost)
                .thenComparingInt(SupplierQuote::getLeadTimeDays)
                .thenComparing(SupplierQuote::getSupplierId));
        List<String> tags = new ArrayList<>(List.of(TAG_NAIVE_FALLBACK));
        if (cheapest.isEmpty()) {
            tags.add("missing_supplier");
        }
        double unitCost = cheapest.map(SupplierQuote::getUnitCost).orElse(position.getUnitCost());
        double fixedCost = cheapest.map(SupplierQuote::getFixedOrderCost).orElse(0.0);
        return Optional.of(ReorderSuggestion.builder()
            .itemId(itemId)
            .supplierId(cheapest.map(SupplierQuote::getSupplierId).orElse(ReorderSuggestion.NO_SUPPLIER))
            .suggestedQuantity(quantity)
            .suggestedOrderDate(today)
            .estimatedCost(quantity * unitCost + fixedCost)
            .rationaleTags(List.copyOf(tags))
            .reorderPoint(threshold)
            .safetyStock(0.0)
            .inventoryPosition(onHand)
            .daysOfCover(onHand / avgDaily)
            .priority(RiskLevel.MEDIUM)
            .supplierOptions(List.of())
            .build());
    }

    // All batches of an item form one stock position for reordering.
    private static InventoryState combine(String itemId, List<InventoryState> batches) {
        double onHand = 0.0;
        double inTransit = 0.0;
        double value = 0.0;
        int leadTime = 0;
        for (InventoryState batch : batches) {
            onHand += batch.getQuantityOnHand();
            inTransit += batch.getQuantityInTransit();
            value += batch.getQuantityOnHand() * batch.getUnitCost();
            leadTime = Math.max(leadTime, batch.getLeadTimeDays());
        }
        double unitCost = onHand > 0.0 ? value / onHand : batches.get(0).getUnitCost();
        return InventoryState.builder()
            .itemId(itemId)
            .quantityOnHand(onHand)
            .quantityInTransit(inTransit)
            .unitCost(unitCost)
            .leadTimeDays(leadTime)
            .supplierId(batches.get(0).getSupplierId())
            .build();
    }

    private static List<SupplierQuote> suppliersFor(String itemId, List<SupplierQuote> suppliers) {
        return suppliers.stream()
            .filter(q -> q.getItemId() == null || q.getItemId().equals(itemId))
            .toList();
    }

    private static ItemRunResult failed(String itemId, String code, String message) {
        return ItemRunResult.builder()
            .itemId(itemId)
            .status(ItemRunStatus.FAILED)
            .errorCode(code)
            .message(message)
            .build();
    }

    private BatchRunResponse.Summary summarize(List<ItemRunResult> results) {
        int ok = 0;
        int insufficient = 0;
        int failed = 0;
        int reorders = 0;
        int highRisk = 0;
        int anomalies = 0;
        for (ItemRunResult r : results) {
            switch (r.getStatus()) {
                case OK -> ok++;
                case INSUFFICIENT_DATA -> insufficient++;
                case FAILED -> failed++;
            }
            if (r.getReorder() != null) {
                reorders++;
            }
            if (r.getExpiryRisks() != null) {
                highRisk += (int) r.getExpiryRisks().stream()
                    .filter(s -> s.getRiskProbability() >= engine.getSettings().getReturnThreshold())
                    .count();
            }
            if (r.getAnomalies() != null) {
                anomalies += r.getAnomalies().size();
            }
        }
        return BatchRunResponse.Summary.builder()
            .items(results.size())
            .succeeded(ok)
            .insufficientData(insufficient)
            .failed(failed)
            .reorders(reorders)
            .highRiskBatches(highRisk)
            .anomalies(anomalies)
            .build();
    }
}
