package com.pharmaintel.engine;

import com.pharmaintel.domain.ConsumptionRecord;
import com.pharmaintel.domain.Granularity;
import com.pharmaintel.domain.SeriesPoint;
import com.pharmaintel.domain.TimeSeries;
import com.pharmaintel.exception.InsufficientDataException;
import com.pharmaintel.exception.InvalidEngineInputException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
public class ConsumptionAggregator {

    private final EngineSettings settings;
    private final Clock clock;

    public ConsumptionAggregator(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public TimeSeries aggregate(String itemId, List<ConsumptionRecord> records, Granularity granularity) {
        if (granularity == null) {
            throw new InvalidEngineInputException("granularity is required");
        }
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException(itemId, 0, settings.getMinPeriods());
        }

        TreeMap<LocalDate, Double> buckets = new TreeMap<>();
        for (ConsumptionRecord record : records) {
            if (itemId != null && !itemId.equals(record.getItemId())) {
                throw new InvalidEngineInputException(
                    "record for item '" + record.getItemId() + "' passed while aggregating '" + itemId + "'");
            }
            if (record.getTimestamp() == null) {
                throw new InvalidEngineInputException("record timestamp is required");
            }
            if (record.getQuantityConsumed() < 0.0 || !Double.isFinite(record.getQuantityConsumed())) {
                throw new InvalidEngineInputException("quantityConsumed must be a non-negative number");
            }
            LocalDate day = record.getTimestamp().atZone(settings.getZone()).toLocalDate();
            buckets.merge(granularity.periodStart(day), record.getQuantityConsumed(), Double::sum);
        }

        LocalDate current = granularity.periodStart(LocalDate.now(clock.withZone(settings.getZone())));
        LocalDate last = buckets.lastKey().isAfter(current) ? buckets.lastKey() : current;

        List<SeriesPoint> points = new ArrayList<>();
        for (LocalDate period = buckets.firstKey(); !period.isAfter(last); period = granularity.next(period)) {
            points.add(new SeriesPoint(period, buckets.getOrDefault(period, 0.0)));
        }
        if (points.size() < settings.getMinPeriods()) {
            throw new InsufficientDataException(itemId, points.size(), settings.getMinPeriods());
        }

        log.debug("Series aggregated | itemId={} | granularity={} | periods={} | records={}",
                  itemId, granularity, points.size(), records.size());
        return TimeSeries.builder()
            .itemId(itemId)
            .granularity(granularity)
            .points(List.copyOf(points))
            .build();
    }

    public Map<String, List<ConsumptionRecord>> groupByItem(List<ConsumptionRecord> records) {
        Map<String, List<ConsumptionRecord>> grouped = new TreeMap<>();
        for (ConsumptionRecord record : records) {
            if (record.getItemId() == null || record.getItemId().isBlank()) {
                throw new InvalidEngineInputException("record itemId is required");
            }
            grouped.computeIfAbsent(record.getItemId(), id -> new ArrayList<>()).add(record);
        }
        return grouped;
    }
}
