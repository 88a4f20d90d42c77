package io.b2mash.crewhours.worker;

import io.b2mash.crewhours.exception.InvalidStateException;
import io.b2mash.crewhours.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only view of the worker roster. */
@Service
public class WorkerDirectory {

  private final WorkerRepository workerRepository;

  public WorkerDirectory(WorkerRepository workerRepository) {
    this.workerRepository = workerRepository;
  }

  @Transactional(readOnly = true)
  public Worker requireActiveWorker(UUID workerId) {
    var worker =
        workerRepository
            .findById(workerId)
            .orElseThrow(() -> new ResourceNotFoundException("Worker", workerId));
    if (!worker.isActive()) {
      throw new InvalidStateException(
          "Worker inactive", "Worker " + workerId + " is not active and cannot clock in");
    }
    return worker;
  }

  @Transactional(readOnly = true)
  public List<Worker> findActiveWorkers() {
    return workerRepository.findAllActive();
  }

  public Map<UUID, String> resolveNames(Collection<UUID> workerIds) {
    if (workerIds.isEmpty()) return Map.of();

    return workerRepository.findAllById(workerIds).stream()
        .collect(Collectors.toMap(Worker::getId, Worker::getName, (a, b) -> a));
  }
}
