package io.b2mash.crewhours.timeblock;

import io.b2mash.crewhours.reporting.HoursFormatter;
import io.b2mash.crewhours.worker.WorkerDirectory;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ClockController {

  private final ClockService clockService;
  private final TimeBlockQueryService queryService;
  private final WorkerDirectory workerDirectory;

  public ClockController(
      ClockService clockService,
      TimeBlockQueryService queryService,
      WorkerDirectory workerDirectory) {
    this.clockService = clockService;
    this.queryService = queryService;
    this.workerDirectory = workerDirectory;
  }

  @PostMapping("/api/workers/{workerId}/clock-in")
  public ResponseEntity<TimeBlockResponse> clockIn(
      @PathVariable UUID workerId, @RequestBody(required = false) ClockRequest request) {
    var block = clockService.clockIn(workerId, request != null ? request.timestamp() : null);
    return ResponseEntity.created(URI.create("/api/time-blocks/" + block.getId()))
        .body(TimeBlockResponse.from(block));
  }

  @PostMapping("/api/workers/{workerId}/clock-out")
  public ResponseEntity<TimeBlockResponse> clockOut(
      @PathVariable UUID workerId, @RequestBody(required = false) ClockRequest request) {
    var block = clockService.clockOut(workerId, request != null ? request.timestamp() : null);
    return ResponseEntity.ok(TimeBlockResponse.from(block));
  }

  @GetMapping("/api/workers/{workerId}/clock-status")
  public ResponseEntity<ClockStatusResponse> clockStatus(@PathVariable UUID workerId) {
    var active = queryService.findActiveBlock(workerId);
    return ResponseEntity.ok(
        new ClockStatusResponse(
            workerId, active.isPresent(), active.map(TimeBlockResponse::from).orElse(null)));
  }

  @GetMapping("/api/workers/{workerId}/time-blocks")
  public ResponseEntity<List<TimeBlockResponse>> listTimeBlocks(
      @PathVariable UUID workerId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    var blocks = queryService.findBlocks(workerId, date);
    return ResponseEntity.ok(blocks.stream().map(TimeBlockResponse::from).toList());
  }

  @GetMapping("/api/workers/{workerId}/hours")
  public ResponseEntity<DailyHoursResponse> totalHours(
      @PathVariable UUID workerId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    double hours = queryService.totalHours(workerId, date);
    return ResponseEntity.ok(
        new DailyHoursResponse(workerId, date, hours, HoursFormatter.format(hours)));
  }

  @GetMapping("/api/time-blocks/{timeBlockId}")
  public ResponseEntity<TimeBlockResponse> getTimeBlock(@PathVariable UUID timeBlockId) {
    return ResponseEntity.ok(TimeBlockResponse.from(queryService.getBlock(timeBlockId)));
  }

  @GetMapping("/api/time-blocks/active")
  public ResponseEntity<List<ActiveBlockResponse>> listActiveBlocks() {
    var blocks = queryService.findAllActiveBlocks();
    Map<UUID, String> names =
        workerDirectory.resolveNames(blocks.stream().map(TimeBlock::getWorkerId).toList());
    return ResponseEntity.ok(
        blocks.stream()
            .map(
                b ->
                    new ActiveBlockResponse(
                        names.get(b.getWorkerId()), TimeBlockResponse.from(b)))
            .toList());
  }

  @GetMapping("/api/time-blocks/active/workers")
  public ResponseEntity<List<ClockedInWorkerResponse>> listClockedInWorkers() {
    var workerIds = queryService.findClockedInWorkerIds();
    Map<UUID, String> names = workerDirectory.resolveNames(workerIds);
    return ResponseEntity.ok(
        workerIds.stream().map(id -> new ClockedInWorkerResponse(id, names.get(id))).toList());
  }

  // --- DTOs ---

  public record ClockRequest(Instant timestamp) {}

  public record TimeBlockResponse(
      UUID id,
      UUID workerId,
      LocalDate date,
      int blockNumber,
      Instant clockInTime,
      Instant clockOutTime,
      double hoursWorked,
      String formattedHours,
      boolean active,
      int weekNumber,
      int weekYear) {

    public static TimeBlockResponse from(TimeBlock block) {
      return new TimeBlockResponse(
          block.getId(),
          block.getWorkerId(),
          block.getDate(),
          block.getBlockNumber(),
          block.getClockInTime(),
          block.getClockOutTime(),
          block.getHoursWorked(),
          HoursFormatter.format(block.getHoursWorked()),
          block.isActive(),
          block.getWeekNumber(),
          block.getWeekYear());
    }
  }

  public record ClockStatusResponse(
      UUID workerId, boolean clockedIn, TimeBlockResponse activeBlock) {}

  public record DailyHoursResponse(
      UUID workerId, LocalDate date, double totalHours, String formatted) {}

  public record ActiveBlockResponse(String workerName, TimeBlockResponse block) {}

  public record ClockedInWorkerResponse(UUID workerId, String workerName) {}
}
