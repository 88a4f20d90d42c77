package io.b2mash.crewhours.reporting;

import io.b2mash.crewhours.config.TimeTrackingProperties;
import io.b2mash.crewhours.exception.InvalidStateException;
import io.b2mash.crewhours.timeblock.TimeBlock;
import io.b2mash.crewhours.timeblock.TimeBlockQueryService;
import io.b2mash.crewhours.worker.WorkerDirectory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rollups over closed time blocks. Open blocks are excluded until clocked out, so a report reflects
 * completed work only.
 */
@Service
public class TimeReportingService {

  private static final Logger log = LoggerFactory.getLogger(TimeReportingService.class);

  private static final int DAYS_PER_WEEK = 7;

  private final TimeBlockQueryService queryService;
  private final WorkerDirectory workerDirectory;
  private final TimeTrackingProperties properties;

  public TimeReportingService(
      TimeBlockQueryService queryService,
      WorkerDirectory workerDirectory,
      TimeTrackingProperties properties) {
    this.queryService = queryService;
    this.workerDirectory = workerDirectory;
    this.properties = properties;
  }

  /** Report for the Monday-to-Sunday week containing {@code anyDayOfWeek}. */
  @Transactional(readOnly = true)
  public WeeklyReport generateWeeklyReport(UUID workerId, LocalDate anyDayOfWeek) {
    LocalDate weekStart = weekStartOf(anyDayOfWeek);
    LocalDate weekEnd = weekStart.plusDays(DAYS_PER_WEEK);

    Map<LocalDate, Double> hoursByDay =
        queryService.findCompletedBlocks(workerId, weekStart, weekEnd).stream()
            .collect(
                Collectors.groupingBy(
                    TimeBlock::getDate, Collectors.summingDouble(TimeBlock::getHoursWorked)));

    double dailyThreshold = properties.dailyOvertimeThresholdHours();
    var dailyEntries = new ArrayList<DailyHours>(DAYS_PER_WEEK);
    double weeklyTotal = 0.0;
    double dailyOvertimePool = 0.0;
    for (int i = 0; i < DAYS_PER_WEEK; i++) {
      LocalDate day = weekStart.plusDays(i);
      double hours = hoursByDay.getOrDefault(day, 0.0);
      boolean overDaily = hours > dailyThreshold;
      double dayOvertime = overDaily ? hours - dailyThreshold : 0.0;
      dailyEntries.add(new DailyHours(day, hours, dayOvertime, overDaily));
      weeklyTotal += hours;
      dailyOvertimePool += dayOvertime;
    }

    double weeklyThreshold = properties.weeklyOvertimeThresholdHours();
    double regular = Math.min(weeklyTotal, weeklyThreshold);
    double overtime = weeklyTotal > weeklyThreshold ? weeklyTotal - weeklyThreshold : 0.0;

    log.debug(
        "Weekly report for worker {} week of {}: total={}, overtime={}",
        workerId,
        weekStart,
        weeklyTotal,
        overtime);
    return new WeeklyReport(
        workerId,
        weekStart,
        List.copyOf(dailyEntries),
        regular,
        overtime,
        dailyOvertimePool,
        weeklyTotal);
  }

  /**
   * Hours over {@code [periodStart, periodEnd)} and, when a rate is given, {@code hours x rate}. No
   * overtime split is applied.
   */
  @Transactional(readOnly = true)
  public PayrollRecord calculatePayroll(
      UUID workerId, LocalDate periodStart, LocalDate periodEnd, BigDecimal hourlyRate) {
    if (!periodEnd.isAfter(periodStart)) {
      throw new InvalidStateException(
          "Invalid pay period",
          "Period end " + periodEnd + " must be after period start " + periodStart);
    }
    requireNonNegativeRate(hourlyRate);

    double totalHours =
        queryService.findCompletedBlocks(workerId, periodStart, periodEnd).stream()
            .mapToDouble(TimeBlock::getHoursWorked)
            .sum();

    BigDecimal estimatedPay =
        hourlyRate != null
            ? BigDecimal.valueOf(totalHours).multiply(hourlyRate).setScale(2, RoundingMode.HALF_UP)
            : null;
    return new PayrollRecord(
        workerId, periodStart, periodEnd, totalHours, hourlyRate, estimatedPay);
  }

  /** Active workers whose weekly total exceeds the weekly threshold, ordered by name. */
  @Transactional(readOnly = true)
  public OvertimeReport generateOvertimeReport(LocalDate anyDayOfWeek, BigDecimal hourlyRate) {
    requireNonNegativeRate(hourlyRate);
    LocalDate weekStart = weekStartOf(anyDayOfWeek);

    var workers = new ArrayList<WorkerOvertime>();
    double totalOvertime = 0.0;
    for (var worker : workerDirectory.findActiveWorkers()) {
      var report = generateWeeklyReport(worker.getId(), weekStart);
      if (!report.isWeeklyOvertime()) {
        continue;
      }
      workers.add(
          new WorkerOvertime(
              worker.getId(),
              worker.getName(),
              report.totalRegularHours(),
              report.totalOvertimeHours(),
              dailyOvertimeBreakdown(report)));
      totalOvertime += report.totalOvertimeHours();
    }

    BigDecimal estimatedCost =
        hourlyRate != null
            ? BigDecimal.valueOf(totalOvertime)
                .multiply(hourlyRate)
                .multiply(properties.overtimeRateMultiplier())
                .setScale(2, RoundingMode.HALF_UP)
            : null;

    log.info(
        "Overtime report for week of {}: {} workers, {} overtime hours",
        weekStart,
        workers.size(),
        totalOvertime);
    return new OvertimeReport(weekStart, List.copyOf(workers), totalOvertime, estimatedCost);
  }

  static LocalDate weekStartOf(LocalDate anyDay) {
    return anyDay.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
  }

  private static Map<LocalDate, Double> dailyOvertimeBreakdown(WeeklyReport report) {
    var breakdown = new LinkedHashMap<LocalDate, Double>();
    for (var entry : report.dailyEntries()) {
      if (entry.isDailyOvertime()) {
        breakdown.put(entry.date(), entry.dailyOvertimeHours());
      }
    }
    return breakdown;
  }

  private static void requireNonNegativeRate(BigDecimal hourlyRate) {
    if (hourlyRate != null && hourlyRate.signum() < 0) {
      throw new InvalidStateException(
          "Invalid hourly rate", "Hourly rate must not be negative, got " + hourlyRate);
    }
  }
}
