package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
@Jacksonized
public class TimeSeries {

    String itemId;

    @NotNull(message = "granularity is required")
    Granularity granularity;

    @NotEmpty(message = "points must not be empty")
    List<SeriesPoint> points;

    public static TimeSeries of(String itemId, Granularity granularity, LocalDate start, double... values) {
        List<SeriesPoint> points = new ArrayList<>(values.length);
        LocalDate period = granularity.periodStart(start);
        for (double value : values) {
            points.add(new SeriesPoint(period, value));
            period = granularity.next(period);
        }
        return TimeSeries.builder().itemId(itemId).granularity(granularity).points(List.copyOf(points)).build();
    }

    public int size() {
        return points == null ? 0 : points.size();
    }

    public double[] values() {
        return points.stream().mapToDouble(SeriesPoint::quantity).toArray();
    }

    public LocalDate firstPeriod() {
        return points.get(0).period();
    }

    public LocalDate lastPeriod() {
        return points.get(points.size() - 1).period();
    }

    public TimeSeries head(int count) {
        return TimeSeries.builder()
            .itemId(itemId)
            .granularity(granularity)
            .points(List.copyOf(points.subList(0, count)))
            .build();
    }

    @JsonIgnore
    public boolean isContiguous() {
        for (int i = 1; i < points.size(); i++) {
            if (!granularity.next(points.get(i - 1).period()).equals(points.get(i).period())) {
                return false;
            }
        }
        return true;
    }
}
