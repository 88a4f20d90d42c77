package io.b2mash.crewhours.timeblock;

import io.b2mash.crewhours.exception.AlreadyClockedInException;
import io.b2mash.crewhours.exception.InvalidStateException;
import io.b2mash.crewhours.exception.NotClockedInException;
import io.b2mash.crewhours.lock.LockRegistry;
import io.b2mash.crewhours.worker.WorkerDirectory;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Clock state machine. A worker is either clocked out (no open block) or clocked in (exactly one
 * open block). Each transition runs in its own transaction while holding the worker's lock, and the
 * lock is released only after commit. The unique open-block column catches writers in other
 * processes.
 */
@Service
public class ClockService {

  private static final Logger log = LoggerFactory.getLogger(ClockService.class);

  private final TimeBlockStore timeBlockStore;
  private final WorkerDirectory workerDirectory;
  private final LockRegistry workerLocks;
  private final TransactionOperations transactionOperations;
  private final Clock clock;

  public ClockService(
      TimeBlockStore timeBlockStore,
      WorkerDirectory workerDirectory,
      LockRegistry workerLocks,
      TransactionOperations transactionOperations,
      Clock clock) {
    this.timeBlockStore = timeBlockStore;
    this.workerDirectory = workerDirectory;
    this.workerLocks = workerLocks;
    this.transactionOperations = transactionOperations;
    this.clock = clock;
  }

  public TimeBlock clockIn(UUID workerId, Instant timestamp) {
    Instant at = timestamp != null ? timestamp : clock.instant();
    try {
      return workerLocks.withLock(
          workerId, () -> transactionOperations.execute(tx -> openBlock(workerId, at)));
    } catch (DataIntegrityViolationException e) {
      log.warn("Concurrent clock-in rejected by store for worker {}", workerId);
      throw new AlreadyClockedInException(workerId);
    }
  }

  public TimeBlock clockOut(UUID workerId, Instant timestamp) {
    Instant at = timestamp != null ? timestamp : clock.instant();
    return workerLocks.withLock(
        workerId, () -> transactionOperations.execute(tx -> closeBlock(workerId, at)));
  }

  private TimeBlock openBlock(UUID workerId, Instant at) {
    workerDirectory.requireActiveWorker(workerId);

    if (timeBlockStore.findActive(workerId).isPresent()) {
      throw new AlreadyClockedInException(workerId);
    }

    LocalDate day = LocalDate.ofInstant(at, clock.getZone());
    int blockNumber =
        timeBlockStore.findByDateRange(workerId, day, day.plusDays(1)).stream()
                .mapToInt(TimeBlock::getBlockNumber)
                .max()
                .orElse(0)
            + 1;

    var saved = timeBlockStore.save(new TimeBlock(workerId, day, blockNumber, at));
    log.info("Worker {} clocked in: block {} on {}", workerId, blockNumber, day);
    return saved;
  }

  private TimeBlock closeBlock(UUID workerId, Instant at) {
    var block =
        timeBlockStore.findActive(workerId).orElseThrow(() -> new NotClockedInException(workerId));

    if (block.getClockInTime() == null) {
      throw new InvalidStateException(
          "Invalid time block state",
          "Active time block "
              + block.getId()
              + " of worker "
              + workerId
              + " has no clock-in time");
    }

    block.close(at);
    var saved = timeBlockStore.update(block);
    log.info(
        "Worker {} clocked out: block {} on {}, {} hours",
        workerId,
        saved.getBlockNumber(),
        saved.getDate(),
        saved.getHoursWorked());
    return saved;
  }
}
