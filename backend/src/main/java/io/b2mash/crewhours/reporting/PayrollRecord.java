package io.b2mash.crewhours.reporting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Hours over {@code [periodStart, periodEnd)}. {@code estimatedPay} is null when no hourly rate was
 * supplied.
 */
public record PayrollRecord(
    UUID workerId,
    LocalDate periodStart,
    LocalDate periodEnd,
    double totalHours,
    BigDecimal hourlyRate,
    BigDecimal estimatedPay) {}
