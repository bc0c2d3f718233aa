package com.pharmaintel.engine;

import com.pharmaintel.domain.AbcClassification;
import com.pharmaintel.domain.AnomalyFlag;
import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.ConsumptionShift;
import com.pharmaintel.domain.ExpiryRiskScore;
import com.pharmaintel.domain.ForecastResult;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.InteractionQueryResult;
import com.pharmaintel.domain.InteractionRuleBase;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.domain.ReorderSuggestion;
import com.pharmaintel.domain.SupplierQuote;
import com.pharmaintel.domain.TimeSeries;
import lombok.Getter;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
public class InventoryIntelligenceEngine {

    private final EngineSettings settings;
    private final ConsumptionAggregator aggregator;
    private final ForecastSelector forecastSelector;
    private final AnomalyDetector anomalyDetector;
    private final ReorderOptimizer reorderOptimizer;
    private final ExpiryRiskScorer expiryRiskScorer;
    private final InteractionMatcher interactionMatcher;
    private final AbcClassifier abcClassifier;

    public InventoryIntelligenceEngine(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.aggregator = new ConsumptionAggregator(settings, clock);
        this.forecastSelector = new ForecastSelector(settings, clock);
        this.anomalyDetector = new AnomalyDetector(settings);
        this.reorderOptimizer = new ReorderOptimizer(settings, clock);
        this.expiryRiskScorer = new ExpiryRiskScorer(settings, clock);
        this.interactionMatcher = new InteractionMatcher(settings);
        this.abcClassifier = new AbcClassifier();
    }

    public TimeSeries aggregate(String itemId, List<ConsumptionRecord> records, Granularity granularity) {
        return aggregator.aggregate(itemId, records, granularity);
    }

    public Map<String, List<ConsumptionRecord>> groupByItem(List<ConsumptionRecord> records) {
        return aggregator.groupByItem(records);
    }

    public ForecastResult forecast(String itemId, TimeSeries series, int horizonPeriods) {
        return forecastSelector.forecast(itemId, series, horizonPeriods);
    }

    public List<AnomalyFlag> detectAnomalies(TimeSeries series) {
        return anomalyDetector.detectAnomalies(series);
    }

    public Optional<ConsumptionShift> detectShift(TimeSeries series, int window) {
        return anomalyDetector.detectShift(series, window);
    }

    public Optional<ReorderSuggestion> recommendReorder(ForecastResult forecast, InventoryState state,
                                                        List<SupplierQuote> suppliers) {
        return reorderOptimizer.recommendReorder(forecast, state, suppliers);
    }

    public ExpiryRiskScore scoreExpiryRisk(ForecastResult forecast, InventoryState batch) {
        return expiryRiskScorer.scoreExpiryRisk(forecast, batch);
    }

    public List<ExpiryRiskScore> scoreExpiryRisks(ForecastResult forecast, List<InventoryState> batches) {
        return expiryRiskScorer.scoreExpiryRisks(forecast, batches);
    }

    public InteractionQueryResult checkInteractions(List<String> drugNames, InteractionRuleBase ruleBase) {
        return interactionMatcher.checkInteractions(drugNames, ruleBase);
    }

    public List<AbcClassification> classifyAbc(List<InventoryState> states) {
        return abcClassifier.classifyAbc(states);
    }
}
