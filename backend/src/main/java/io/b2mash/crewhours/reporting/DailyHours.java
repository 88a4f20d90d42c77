package io.b2mash.crewhours.reporting;

import java.time.LocalDate;

/** Closed-block hours of one day, with the portion above the daily threshold. */
public record DailyHours(
    LocalDate date, double hours, double dailyOvertimeHours, boolean isDailyOvertime) {}
