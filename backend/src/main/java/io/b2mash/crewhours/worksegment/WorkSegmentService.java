package io.b2mash.crewhours.worksegment;

import io.b2mash.crewhours.exception.InvalidStateException;
import io.b2mash.crewhours.exception.ResourceConflictException;
import io.b2mash.crewhours.exception.ResourceNotFoundException;
import io.b2mash.crewhours.lock.LockRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Start and close transitions of crew work segments. Starts hold the work order's lock, closes and
 * crew changes hold the segment's lock, and each lock is released only after commit. The version
 * column and the unique open-segment column catch writers in other processes.
 */
@Service
public class WorkSegmentService {

  private static final Logger log = LoggerFactory.getLogger(WorkSegmentService.class);

  private final WorkSegmentRepository workSegmentRepository;
  private final LockRegistry locks;
  private final TransactionOperations transactionOperations;
  private final Clock clock;

  public WorkSegmentService(
      WorkSegmentRepository workSegmentRepository,
      LockRegistry locks,
      TransactionOperations transactionOperations,
      Clock clock) {
    this.workSegmentRepository = workSegmentRepository;
    this.locks = locks;
    this.transactionOperations = transactionOperations;
    this.clock = clock;
  }

  public WorkSegment startSegment(
      UUID workOrderId, Instant startTime, int teamSize, List<String> teamMembers) {
    requireValidTeamSize(teamSize);
    Instant at = startTime != null ? startTime : clock.instant();
    if (workOrderId == null) {
      return transactionOperations.execute(tx -> openSegment(null, at, teamSize, teamMembers));
    }
    try {
      return locks.withLock(
          workOrderId,
          () ->
              transactionOperations.execute(
                  tx -> {
                    workSegmentRepository
                        .findOpenByWorkOrderId(workOrderId)
                        .ifPresent(open -> throwSegmentOpen(workOrderId, open.getId()));
                    return openSegment(workOrderId, at, teamSize, teamMembers);
                  }));
    } catch (DataIntegrityViolationException e) {
      log.warn("Concurrent segment start rejected by store for work order {}", workOrderId);
      throw segmentOpen(workOrderId);
    }
  }

  public WorkSegment closeSegment(UUID segmentId, Instant endTime) {
    Instant at = endTime != null ? endTime : clock.instant();
    return locks.withLock(
        segmentId,
        () ->
            transactionOperations.execute(
                tx -> {
                  var segment = requireSegment(segmentId);
                  segment.close(at);
                  var saved = workSegmentRepository.saveAndFlush(segment);
                  log.info(
                      "Closed work segment {}: {} team hours", segmentId, saved.getTotalHours());
                  return saved;
                }));
  }

  /**
   * Closes the segment and opens a successor on the same work order when the crew differs. An
   * unchanged crew leaves the segment untouched and returns it.
   */
  public WorkSegment changeTeam(
      UUID segmentId, Instant at, int teamSize, List<String> teamMembers) {
    Instant changeAt = at != null ? at : clock.instant();
    try {
      return locks.withLock(
          segmentId,
          () ->
              transactionOperations.execute(
                  tx -> replaceCrew(segmentId, changeAt, teamSize, teamMembers)));
    } catch (DataIntegrityViolationException e) {
      log.warn("Crew change on segment {} rejected by store", segmentId);
      throw new ResourceConflictException(
          "Work segment open",
          "Another segment was opened on the work order of segment " + segmentId);
    }
  }

  @Transactional(readOnly = true)
  public WorkSegment getSegment(UUID segmentId) {
    return requireSegment(segmentId);
  }

  @Transactional(readOnly = true)
  public List<WorkSegment> listSegments(UUID workOrderId) {
    return workSegmentRepository.findByWorkOrderId(workOrderId);
  }

  /** Accounted labor hours of a work order. Open segments contribute nothing. */
  @Transactional(readOnly = true)
  public double totalLaborHours(UUID workOrderId) {
    return listSegments(workOrderId).stream().mapToDouble(WorkSegment::getTotalHours).sum();
  }

  private WorkSegment replaceCrew(
      UUID segmentId, Instant changeAt, int teamSize, List<String> teamMembers) {
    var current = requireSegment(segmentId);
    if (!current.isActive()) {
      throw new InvalidStateException(
          "Work segment closed", "Work segment " + segmentId + " is already closed");
    }
    if (!current.hasDifferentCrew(teamSize, teamMembers)) {
      return current;
    }
    requireValidTeamSize(teamSize);

    current.close(changeAt);
    workSegmentRepository.saveAndFlush(current);

    var next = openSegment(current.getWorkOrderId(), changeAt, teamSize, teamMembers);
    log.info(
        "Crew change on work order {}: segment {} closed, segment {} started",
        current.getWorkOrderId(),
        segmentId,
        next.getId());
    return next;
  }

  private WorkSegment openSegment(
      UUID workOrderId, Instant at, int teamSize, List<String> teamMembers) {
    var segment =
        workSegmentRepository.saveAndFlush(new WorkSegment(workOrderId, at, teamSize, teamMembers));
    log.info(
        "Started work segment {} for work order {} with team size {}",
        segment.getId(),
        workOrderId,
        teamSize);
    return segment;
  }

  private void requireValidTeamSize(int teamSize) {
    if (teamSize < 0) {
      throw new InvalidStateException(
          "Invalid team size", "Team size must not be negative, got " + teamSize);
    }
  }

  private void throwSegmentOpen(UUID workOrderId, UUID openSegmentId) {
    throw new ResourceConflictException(
        "Work segment open",
        "Work order " + workOrderId + " already has open segment " + openSegmentId);
  }

  private ResourceConflictException segmentOpen(UUID workOrderId) {
    return new ResourceConflictException(
        "Work segment open", "Work order " + workOrderId + " already has an open segment");
  }

  private WorkSegment requireSegment(UUID segmentId) {
    return workSegmentRepository
        .findById(segmentId)
        .orElseThrow(() -> new ResourceNotFoundException("WorkSegment", segmentId));
  }
}
