package io.b2mash.crewhours.timeblock;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeBlockRepository extends JpaRepository<TimeBlock, UUID> {

  @Query("SELECT tb FROM TimeBlock tb WHERE tb.workerId = :workerId AND tb.active = true")
  Optional<TimeBlock> findActiveByWorkerId(@Param("workerId") UUID workerId);

  @Query(
      """
      SELECT tb FROM TimeBlock tb
      WHERE tb.workerId = :workerId
        AND tb.workDate >= :from
        AND tb.workDate < :to
      ORDER BY tb.workDate, tb.blockNumber
      """)
  List<TimeBlock> findByWorkerIdAndDateRange(
      @Param("workerId") UUID workerId, @Param("from") LocalDate from, @Param("to") LocalDate to);

  @Query("SELECT tb FROM TimeBlock tb WHERE tb.active = true ORDER BY tb.clockInTime")
  List<TimeBlock> findAllActive();
}
