package com.pharmaintel.engine;

import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.ReorderSuggestion;
import com.pharmaintel.domain.RiskLevel;
import com.pharmaintel.domain.SupplierOption;
import com.pharmaintel.domain.SupplierQuote;
import com.pharmaintel.exception.InvalidEngineInputException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reorder-point policy with normally distributed daily demand:
 * {@code ROP = rate * L + z * sigma * sqrt(L)}, L in days. Orders are placed only when the
 * inventory position (on hand plus in transit) is at or below the reorder point.
 */
@Slf4j
public class ReorderOptimizer {

    public static final String TAG_BELOW_REORDER_POINT = "below_reorder_point";
    public static final String TAG_MISSING_SUPPLIER = "missing_supplier";
    public static final String TAG_MOQ_APPLIED = "moq_applied";
    public static final String TAG_LOW_CONFIDENCE = "low_confidence_forecast";
    public static final String TAG_SELECTED_SUPPLIER = "selected_supplier:";
    public static final String TAG_RUNNER_UP = "runner_up:";

    private final EngineSettings settings;
    private final Clock clock;
    private final double serviceZ;

    public ReorderOptimizer(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.serviceZ = EngineMath.inverseStandardNormal(settings.getServiceLevel());
    }

    public Optional<ReorderSuggestion> recommendReorder(ForecastResult forecast, InventoryState state,
                                                        List<SupplierQuote> suppliers) {
        validate(forecast, state);
        int leadTime = state.getLeadTimeDays();
        double rate = forecast.dailyRate();
        double safetyStock = serviceZ * forecast.dailyStdDev() * Math.sqrt(leadTime);
        double reorderPoint = rate * leadTime + safetyStock;
        double position = state.getQuantityOnHand() + state.getQuantityInTransit();

        if (rate <= 0.0 && safetyStock <= 0.0) {
            return Optional.empty();
        }
        if (position > reorderPoint) {
            return Optional.empty();
        }

        // Safety stock only moves the trigger; the order itself covers the replenishment horizon.
        double target = rate * settings.getReplenishmentHorizonDays();
        double baseQuantity = Math.ceil(Math.max(0.0, target - position));
        List<String> tags = new ArrayList<>();
        tags.add(TAG_BELOW_REORDER_POINT);
        if (forecast.isLowConfidence()) {
            tags.add(TAG_LOW_CONFIDENCE);
        }

        List<SupplierQuote> quotes = suppliers == null ? List.of() : suppliers.stream()
            .filter(q -> q.getItemId() == null || q.getItemId().equals(state.getItemId()))
            .toList();

        ReorderSuggestion.ReorderSuggestionBuilder builder = ReorderSuggestion.builder()
            .itemId(state.getItemId())
            .suggestedOrderDate(LocalDate.now(clock.withZone(settings.getZone())))
            .reorderPoint(EngineMath.round(reorderPoint))
            .safetyStock(EngineMath.round(safetyStock))
            .inventoryPosition(position)
            .daysOfCover(rate > 0.0 ? EngineMath.round(position / rate) : null)
            .priority(toRiskLevel(EngineMath.clamp((reorderPoint - position) / Math.max(reorderPoint, 1.0), 0.0, 1.0)));

        if (quotes.isEmpty()) {
            if (baseQuantity <= 0.0) {
                return Optional.empty();
            }
            tags.add(TAG_MISSING_SUPPLIER);
            log.warn("No supplier for item below reorder point | itemId={} | position={} | reorderPoint={}",
                     state.getItemId(), position, EngineMath.round(reorderPoint));
            return Optional.of(builder
                .supplierId(ReorderSuggestion.NO_SUPPLIER)
                .suggestedQuantity(baseQuantity)
                .estimatedCost(EngineMath.round(baseQuantity * state.getUnitCost()))
                .rationaleTags(List.copyOf(tags))
                .supplierOptions(List.of())
                .build());
        }

        List<Candidate> ranked = quotes.stream()
            .map(q -> {
                double qty = applyOrderConstraints(baseQuantity, q);
                return new Candidate(q, qty, qty * q.getUnitCost() + (qty > 0.0 ? q.getFixedOrderCost() : 0.0));
            })
            .sorted(Comparator.comparingDouble(Candidate::cost)
                .thenComparingInt(c -> c.quote().getLeadTimeDays())
                .thenComparing(c -> c.quote().getSupplierId()))
            .toList();

        Candidate best = ranked.get(0);
        if (best.quantity() <= 0.0) {
            return Optional.empty();
        }
        tags.add(TAG_SELECTED_SUPPLIER + best.quote().getSupplierId());
        ranked.stream().skip(1).forEach(c -> tags.add(TAG_RUNNER_UP + c.quote().getSupplierId()));
        if (best.quantity() > baseQuantity && best.quote().getMinOrderQuantity() > baseQuantity) {
            tags.add(TAG_MOQ_APPLIED);
        }

        List<SupplierOption> options = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            Candidate c = ranked.get(i);
            options.add(SupplierOption.builder()
                .rank(i + 1)
                .supplierId(c.quote().getSupplierId())
                .quantity(c.quantity())
                .estimatedCost(EngineMath.round(c.cost()))
                .leadTimeDays(c.quote().getLeadTimeDays())
                .build());
        }

        return Optional.of(builder
            .supplierId(best.quote().getSupplierId())
            .suggestedQuantity(best.quantity())
            .estimatedCost(EngineMath.round(best.cost()))
            .rationaleTags(List.copyOf(tags))
            .supplierOptions(List.copyOf(options))
            .build());
    }

    private double applyOrderConstraints(double proposedQty, SupplierQuote quote) {
        if (proposedQty <= 0.0) {
            return 0.0;
        }
        double qty = proposedQty;
        if (quote.getMinOrderQuantity() > 0.0 && qty < quote.getMinOrderQuantity()) {
            qty = quote.getMinOrderQuantity();
        }
        Double multiple = quote.getOrderMultiple();
        if (multiple != null && multiple > 0.0) {
            qty = Math.ceil(qty / multiple) * multiple;
        }
        return Math.ceil(qty);
    }

    private RiskLevel toRiskLevel(double score) {
        if (score >= 0.66) {
            return RiskLevel.HIGH;
        }
        if (score >= 0.33) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static void validate(ForecastResult forecast, InventoryState state) {
        if (forecast == null || forecast.getGranularity() == null) {
            throw new InvalidEngineInputException("forecast with granularity is required");
        }
        if (state == null) {
            throw new InvalidEngineInputException("inventory state is required");
        }
        if (state.getLeadTimeDays() < 0) {
            throw new InvalidEngineInputException("leadTimeDays must be >= 0");
        }
        if (state.getQuantityOnHand() < 0.0 || state.getQuantityInTransit() < 0.0) {
            throw new InvalidEngineInputException("stock quantities must be >= 0");
        }
        if (forecast.getPredictedQuantityPerPeriod() < 0.0 || forecast.getForecastStdDev() < 0.0) {
            throw new InvalidEngineInputException("forecast quantities must be >= 0");
        }
    }

    private record Candidate(SupplierQuote quote, double quantity, double cost) {}
}
