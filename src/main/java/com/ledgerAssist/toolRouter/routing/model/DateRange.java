package com.ledgerAssist.toolRouter.routing.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date span resolved from a temporal phrase.
 */
@Value
public class DateRange {

    LocalDate start;
    LocalDate end;
    DateRangeKind kind;

    public static DateRange calendar(LocalDate start, LocalDate end) {
        return new DateRange(start, end, DateRangeKind.CALENDAR);
    }

    public static DateRange rolling(LocalDate start, LocalDate end) {
        return new DateRange(start, end, DateRangeKind.ROLLING);
    }

    public static DateRange explicit(LocalDate start, LocalDate end) {
        return new DateRange(start, end, DateRangeKind.EXPLICIT);
    }
}
