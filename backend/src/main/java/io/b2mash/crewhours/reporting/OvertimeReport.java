package io.b2mash.crewhours.reporting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OvertimeReport(
    LocalDate weekStartDate,
    List<WorkerOvertime> workers,
    double totalOvertimeHours,
    BigDecimal estimatedOvertimeCost) {}
