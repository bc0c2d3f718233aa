package com.pharmaintel.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

public enum Granularity {
    DAY(1.0, 7),
    WEEK(7.0, 52),
    MONTH(30.4375, 12);

    private final double averageDays;
    private final int seasonLength;

    Granularity(double averageDays, int seasonLength) {
        this.averageDays = averageDays;
        this.seasonLength = seasonLength;
    }

    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.with(TemporalAdjusters.firstDayOfMonth());
        };
    }

    public LocalDate next(LocalDate periodStart) {
        return switch (this) {
            case DAY -> periodStart.plusDays(1);
            case WEEK -> periodStart.plusWeeks(1);
            case MONTH -> periodStart.plusMonths(1);
        };
    }

    public int seasonIndex(LocalDate periodStart) {
        return switch (this) {
            case DAY -> periodStart.getDayOfWeek().getValue();
            case WEEK -> periodStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            case MONTH -> periodStart.getMonthValue();
        };
    }

    public double averageDays() {
        return averageDays;
    }

    public int seasonLength() {
        return seasonLength;
    }
}
