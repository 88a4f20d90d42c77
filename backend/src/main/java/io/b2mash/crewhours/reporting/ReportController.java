package io.b2mash.crewhours.reporting;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReportController {

  private final TimeReportingService reportingService;
  private final Clock clock;

  public ReportController(TimeReportingService reportingService, Clock clock) {
    this.reportingService = reportingService;
    this.clock = clock;
  }

  @GetMapping("/api/workers/{workerId}/weekly-report")
  public ResponseEntity<WeeklyReportResponse> weeklyReport(
      @PathVariable UUID workerId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate week) {
    var report =
        reportingService.generateWeeklyReport(workerId, week != null ? week : LocalDate.now(clock));
    return ResponseEntity.ok(WeeklyReportResponse.from(report));
  }

  @GetMapping("/api/workers/{workerId}/payroll")
  public ResponseEntity<PayrollResponse> payroll(
      @PathVariable UUID workerId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      @RequestParam(required = false) BigDecimal hourlyRate) {
    var payroll = reportingService.calculatePayroll(workerId, from, to, hourlyRate);
    return ResponseEntity.ok(PayrollResponse.from(payroll));
  }

  @GetMapping("/api/reports/overtime")
  public ResponseEntity<OvertimeReportResponse> overtimeReport(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate week,
      @RequestParam(required = false) BigDecimal hourlyRate) {
    var report =
        reportingService.generateOvertimeReport(
            week != null ? week : LocalDate.now(clock), hourlyRate);
    return ResponseEntity.ok(OvertimeReportResponse.from(report));
  }

  // --- DTOs ---

  public record DailyHoursResponse(
      LocalDate date,
      double hours,
      String formatted,
      double dailyOvertimeHours,
      boolean dailyOvertime) {

    public static DailyHoursResponse from(DailyHours day) {
      return new DailyHoursResponse(
          day.date(),
          day.hours(),
          HoursFormatter.format(day.hours()),
          day.dailyOvertimeHours(),
          day.isDailyOvertime());
    }
  }

  public record WeeklyReportResponse(
      UUID workerId,
      LocalDate weekStartDate,
      List<DailyHoursResponse> dailyEntries,
      double weeklyTotal,
      String weeklyTotalFormatted,
      double totalRegularHours,
      double totalOvertimeHours,
      String totalOvertimeFormatted,
      double dailyOvertimeHours,
      boolean weeklyOvertime) {

    public static WeeklyReportResponse from(WeeklyReport report) {
      return new WeeklyReportResponse(
          report.workerId(),
          report.weekStartDate(),
          report.dailyEntries().stream().map(DailyHoursResponse::from).toList(),
          report.weeklyTotal(),
          HoursFormatter.format(report.weeklyTotal()),
          report.totalRegularHours(),
          report.totalOvertimeHours(),
          HoursFormatter.format(report.totalOvertimeHours()),
          report.dailyOvertimeHours(),
          report.isWeeklyOvertime());
    }
  }

  public record PayrollResponse(
      UUID workerId,
      LocalDate periodStart,
      LocalDate periodEnd,
      double totalHours,
      String formatted,
      double roundedHours,
      BigDecimal hourlyRate,
      BigDecimal estimatedPay) {

    public static PayrollResponse from(PayrollRecord payroll) {
      return new PayrollResponse(
          payroll.workerId(),
          payroll.periodStart(),
          payroll.periodEnd(),
          payroll.totalHours(),
          HoursFormatter.format(payroll.totalHours()),
          HoursFormatter.roundToQuarterHour(payroll.totalHours()),
          payroll.hourlyRate(),
          payroll.estimatedPay());
    }
  }

  public record WorkerOvertimeResponse(
      UUID workerId,
      String workerName,
      double regularHours,
      double overtimeHours,
      String overtimeFormatted,
      Map<LocalDate, Double> dailyOvertimeBreakdown) {

    public static WorkerOvertimeResponse from(WorkerOvertime worker) {
      return new WorkerOvertimeResponse(
          worker.workerId(),
          worker.workerName(),
          worker.regularHours(),
          worker.overtimeHours(),
          HoursFormatter.format(worker.overtimeHours()),
          worker.dailyOvertimeBreakdown());
    }
  }

  public record OvertimeReportResponse(
      LocalDate weekStartDate,
      List<WorkerOvertimeResponse> workers,
      double totalOvertimeHours,
      BigDecimal estimatedOvertimeCost) {

    public static OvertimeReportResponse from(OvertimeReport report) {
      return new OvertimeReportResponse(
          report.weekStartDate(),
          report.workers().stream().map(WorkerOvertimeResponse::from).toList(),
          report.totalOvertimeHours(),
          report.estimatedOvertimeCost());
    }
  }
}
