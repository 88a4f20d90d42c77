package io.b2mash.crewhours.timeblock;

import io.b2mash.crewhours.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read side of the time block store. */
@Service
public class TimeBlockQueryService {

  private final TimeBlockStore timeBlockStore;
  private final Clock clock;

  public TimeBlockQueryService(TimeBlockStore timeBlockStore, Clock clock) {
    this.timeBlockStore = timeBlockStore;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public TimeBlock getBlock(UUID timeBlockId) {
    return timeBlockStore
        .findById(timeBlockId)
        .orElseThrow(() -> new ResourceNotFoundException("TimeBlock", timeBlockId));
  }

  @Transactional(readOnly = true)
  public Optional<TimeBlock> findActiveBlock(UUID workerId) {
    return timeBlockStore.findActive(workerId);
  }

  @Transactional(readOnly = true)
  public boolean isClockedIn(UUID workerId) {
    return timeBlockStore.findActive(workerId).isPresent();
  }

  /** All blocks of one calendar day, open or closed, ordered by block number. */
  @Transactional(readOnly = true)
  public List<TimeBlock> findBlocks(UUID workerId, LocalDate date) {
    return timeBlockStore.findByDateRange(workerId, date, date.plusDays(1));
  }

  /**
   * Hours for one calendar day. An open block counts with its running duration as of now; that
   * figure is computed on read and never stored.
   */
  @Transactional(readOnly = true)
  public double totalHours(UUID workerId, LocalDate date) {
    var now = clock.instant();
    return findBlocks(workerId, date).stream().mapToDouble(b -> b.elapsedHours(now)).sum();
  }

  /** Closed blocks dated within {@code [from, to)}. */
  @Transactional(readOnly = true)
  public List<TimeBlock> findCompletedBlocks(UUID workerId, LocalDate from, LocalDate to) {
    return timeBlockStore.findByDateRange(workerId, from, to).stream()
        .filter(b -> !b.isActive())
        .toList();
  }

  @Transactional(readOnly = true)
  public List<TimeBlock> findAllActiveBlocks() {
    return timeBlockStore.findAllActive();
  }

  @Transactional(readOnly = true)
  public List<UUID> findClockedInWorkerIds() {
    return timeBlockStore.findAllActive().stream().map(TimeBlock::getWorkerId).distinct().toList();
  }
}
