package io.b2mash.crewhours.reporting;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record WorkerOvertime(
    UUID workerId,
    String workerName,
    double regularHours,
    double overtimeHours,
    Map<LocalDate, Double> dailyOvertimeBreakdown) {}
