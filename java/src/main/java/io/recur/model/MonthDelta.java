package io.recur.model;

/**
 * Sealed interface for month-based deltas: either on fixed days of the month ({@link
 * MonthDeltaDate}) or on an ordinal weekday of the month ({@link MonthDeltaWeek}).
 */
public sealed interface MonthDelta extends RepDelta permits MonthDeltaDate, MonthDeltaWeek {}
