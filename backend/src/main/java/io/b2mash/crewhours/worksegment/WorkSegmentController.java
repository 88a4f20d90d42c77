package io.b2mash.crewhours.worksegment;

import io.b2mash.crewhours.reporting.HoursFormatter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkSegmentController {

  private final WorkSegmentService workSegmentService;

  public WorkSegmentController(WorkSegmentService workSegmentService) {
    this.workSegmentService = workSegmentService;
  }

  @PostMapping("/api/work-segments")
  public ResponseEntity<WorkSegmentResponse> startSegment(
      @Valid @RequestBody StartSegmentRequest request) {
    var segment =
        workSegmentService.startSegment(
            request.workOrderId(), request.startTime(), request.teamSize(), request.teamMembers());
    return ResponseEntity.created(URI.create("/api/work-segments/" + segment.getId()))
        .body(WorkSegmentResponse.from(segment));
  }

  @GetMapping("/api/work-segments/{segmentId}")
  public ResponseEntity<WorkSegmentResponse> getSegment(@PathVariable UUID segmentId) {
    return ResponseEntity.ok(WorkSegmentResponse.from(workSegmentService.getSegment(segmentId)));
  }

  @PostMapping("/api/work-segments/{segmentId}/close")
  public ResponseEntity<WorkSegmentResponse> closeSegment(
      @PathVariable UUID segmentId, @RequestBody(required = false) CloseSegmentRequest request) {
    var segment =
        workSegmentService.closeSegment(segmentId, request != null ? request.endTime() : null);
    return ResponseEntity.ok(WorkSegmentResponse.from(segment));
  }

  @PostMapping("/api/work-segments/{segmentId}/team-change")
  public ResponseEntity<WorkSegmentResponse> changeTeam(
      @PathVariable UUID segmentId, @Valid @RequestBody TeamChangeRequest request) {
    var segment =
        workSegmentService.changeTeam(
            segmentId, request.at(), request.teamSize(), request.teamMembers());
    return ResponseEntity.ok(WorkSegmentResponse.from(segment));
  }

  @GetMapping("/api/work-orders/{workOrderId}/work-segments")
  public ResponseEntity<List<WorkSegmentResponse>> listSegments(@PathVariable UUID workOrderId) {
    var segments = workSegmentService.listSegments(workOrderId);
    return ResponseEntity.ok(segments.stream().map(WorkSegmentResponse::from).toList());
  }

  @GetMapping("/api/work-orders/{workOrderId}/labor-hours")
  public ResponseEntity<LaborHoursResponse> laborHours(@PathVariable UUID workOrderId) {
    int segmentCount = workSegmentService.listSegments(workOrderId).size();
    double total = workSegmentService.totalLaborHours(workOrderId);
    return ResponseEntity.ok(
        new LaborHoursResponse(workOrderId, segmentCount, total, HoursFormatter.format(total)));
  }

  // --- DTOs ---

  public record StartSegmentRequest(
      UUID workOrderId,
      Instant startTime,
      @NotNull @PositiveOrZero Integer teamSize,
      List<@NotBlank String> teamMembers) {}

  public record CloseSegmentRequest(Instant endTime) {}

  public record TeamChangeRequest(
      Instant at,
      @NotNull @PositiveOrZero Integer teamSize,
      List<@NotBlank String> teamMembers) {}

  public record WorkSegmentResponse(
      UUID id,
      UUID workOrderId,
      Instant startTime,
      Instant endTime,
      int teamSize,
      List<String> teamMembers,
      double totalHours,
      String formattedHours,
      boolean active) {

    public static WorkSegmentResponse from(WorkSegment segment) {
      return new WorkSegmentResponse(
          segment.getId(),
          segment.getWorkOrderId(),
          segment.getStartTime(),
          segment.getEndTime(),
          segment.getTeamSize(),
          segment.getTeamMembers(),
          segment.getTotalHours(),
          HoursFormatter.format(segment.getTotalHours()),
          segment.isActive());
    }
  }

  public record LaborHoursResponse(
      UUID workOrderId, int segmentCount, double totalHours, String formatted) {}
}
