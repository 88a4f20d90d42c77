package io.b2mash.crewhours.reporting;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * One worker's Monday-to-Sunday rollup. The regular/overtime split is computed on the week total;
 * {@code dailyOvertimeHours} is the informational pool of per-day excess.
 */
public record WeeklyReport(
    UUID workerId,
    LocalDate weekStartDate,
    List<DailyHours> dailyEntries,
    double totalRegularHours,
    double totalOvertimeHours,
    double dailyOvertimeHours,
    double weeklyTotal) {

  public boolean isWeeklyOvertime() {
    return totalOvertimeHours > 0;
  }
}
