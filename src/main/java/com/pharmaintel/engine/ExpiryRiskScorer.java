package com.pharmaintel.engine;

import com.pharmaintel.domain.ExpiryAction;
import com.pharmaintel.domain.ExpiryRiskScore;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.exception.InvalidEngineInputException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class ExpiryRiskScorer {

    private final EngineSettings settings;
    private final Clock clock;

    public ExpiryRiskScorer(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public ExpiryRiskScore scoreExpiryRisk(ForecastResult forecast, InventoryState batch) {
        requireForecast(forecast);
        return score(forecast.dailyRate(), batch, 0.0, today());
    }

    /**
     * Scores all batches of one item first-expiry-first-out: demand is allocated to the batch
     * expiring soonest, and a later batch only sees what earlier batches leave over. Results
     * follow the input order.
     */
    public List<ExpiryRiskScore> scoreExpiryRisks(ForecastResult forecast, List<InventoryState> batches) {
        requireForecast(forecast);
        if (batches == null || batches.isEmpty()) {
            return List.of();
        }
        LocalDate today = today();
        double rate = forecast.dailyRate();
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparing((Integer i) -> batches.get(i).getExpiryDate(),
            Comparator.nullsLast(Comparator.naturalOrder())));

        ExpiryRiskScore[] scores = new ExpiryRiskScore[batches.size()];
        double allocated = 0.0;
        for (int i : order) {
            ExpiryRiskScore score = score(rate, batches.get(i), allocated, today);
            allocated += score.getExpectedConsumption();
            scores[i] = score;
        }
        return List.of(scores);
    }

    private ExpiryRiskScore score(double dailyRate, InventoryState batch, double alreadyAllocated, LocalDate today) {
        if (batch == null) {
            throw new InvalidEngineInputException("batch is required");
        }
        double quantity = batch.getQuantityOnHand();
        if (quantity < 0.0) {
            throw new InvalidEngineInputException("quantityOnHand must be >= 0");
        }
        ExpiryRiskScore.ExpiryRiskScoreBuilder builder = ExpiryRiskScore.builder()
            .batchId(batch.getBatchId())
            .itemId(batch.getItemId());

        if (batch.getExpiryDate() == null) {
            return builder.riskProbability(0.0)
                .projectedWastageQuantity(0.0)
                .recommendedAction(ExpiryAction.NONE)
                .expectedConsumption(dailyRate > 0.0 ? quantity : 0.0)
                .build();
        }

        long days = Math.max(0L, ChronoUnit.DAYS.between(today, batch.getExpiryDate()));
        builder.daysUntilExpiry(days);
        if (quantity == 0.0) {
            return builder.riskProbability(0.0)
                .projectedWastageQuantity(0.0)
                .recommendedAction(ExpiryAction.NONE)
                .expectedConsumption(0.0)
                .build();
        }

        double willConsume = Math.min(quantity, Math.max(0.0, dailyRate * days - alreadyAllocated));
        double shortfall = Math.max(0.0, 1.0 - willConsume / quantity);
        double risk = EngineMath.clamp(shortfall * settings.getExpiryScale(), 0.0, 1.0);
        return builder.riskProbability(EngineMath.round(risk))
            .projectedWastageQuantity(EngineMath.round(quantity - willConsume))
            .recommendedAction(actionFor(risk, batch))
            .expectedConsumption(EngineMath.round(willConsume))
            .build();
    }

    private ExpiryAction actionFor(double risk, InventoryState batch) {
        if (risk >= settings.getReturnThreshold()) {
            return batch.isReturnWindowOpen() ? ExpiryAction.RETURN_TO_SUPPLIER : ExpiryAction.DISCOUNT;
        }
        if (risk >= settings.getDiscountThreshold()) {
            return batch.isRedistributable() ? ExpiryAction.REDISTRIBUTE : ExpiryAction.DISCOUNT;
        }
        return ExpiryAction.NONE;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(settings.getZone()));
    }

    private static void requireForecast(ForecastResult forecast) {
        if (forecast == null || forecast.getGranularity() == null) {
            throw new InvalidEngineInputException("forecast with granularity is required");
        }
    }
}
