package io.b2mash.crewhours.worker;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface WorkerRepository extends JpaRepository<Worker, UUID> {

  @Query("SELECT w FROM Worker w WHERE w.active = true ORDER BY w.name")
  List<Worker> findAllActive();
}
