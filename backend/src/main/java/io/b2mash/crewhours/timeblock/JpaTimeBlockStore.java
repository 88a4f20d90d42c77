package io.b2mash.crewhours.timeblock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class JpaTimeBlockStore implements TimeBlockStore {

  private final TimeBlockRepository timeBlockRepository;

  public JpaTimeBlockStore(TimeBlockRepository timeBlockRepository) {
    this.timeBlockRepository = timeBlockRepository;
  }

  @Override
  public TimeBlock save(TimeBlock block) {
    return timeBlockRepository.saveAndFlush(block);
  }

  @Override
  public TimeBlock update(TimeBlock block) {
    return timeBlockRepository.saveAndFlush(block);
  }

  @Override
  public Optional<TimeBlock> findById(UUID id) {
    return timeBlockRepository.findById(id);
  }

  @Override
  public Optional<TimeBlock> findActive(UUID workerId) {
    return timeBlockRepository.findActiveByWorkerId(workerId);
  }

  @Override
  public List<TimeBlock> findByDateRange(UUID workerId, LocalDate from, LocalDate to) {
    return timeBlockRepository.findByWorkerIdAndDateRange(workerId, from, to);
  }

  @Override
  public List<TimeBlock> findAllActive() {
    return timeBlockRepository.findAllActive();
  }
}
