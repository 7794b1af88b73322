package com.ledgerAssist.toolRouter.routing.model;

/**
 * Distinguishes date spans aligned to calendar units from spans counted back from today.
 */
public enum DateRangeKind {
    CALENDAR,
    ROLLING,
    EXPLICIT
}
