package io.b2mash.crewhours.timeblock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for time blocks. Implementations surface constraint violations from {@link
 * #save(TimeBlock)} and {@link #update(TimeBlock)} immediately as {@link
 * org.springframework.dao.DataIntegrityViolationException}, so callers observe them inside their
 * own transaction.
 */
public interface TimeBlockStore {

  TimeBlock save(TimeBlock block);

  TimeBlock update(TimeBlock block);

  Optional<TimeBlock> findById(UUID id);

  Optional<TimeBlock> findActive(UUID workerId);

  /**
   * Blocks of one worker dated within {@code [from, to)}, ordered by date then block number. Open
   * blocks are included.
   */
  List<TimeBlock> findByDateRange(UUID workerId, LocalDate from, LocalDate to);

  List<TimeBlock> findAllActive();
}
