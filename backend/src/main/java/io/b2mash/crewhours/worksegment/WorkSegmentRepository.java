package io.b2mash.crewhours.worksegment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkSegmentRepository extends JpaRepository<WorkSegment, UUID> {

  @Query(
      """
      SELECT s FROM WorkSegment s
      WHERE s.workOrderId = :workOrderId
      ORDER BY s.startTime ASC
      """)
  List<WorkSegment> findByWorkOrderId(@Param("workOrderId") UUID workOrderId);

  @Query(
      """
      SELECT s FROM WorkSegment s
      WHERE s.workOrderId = :workOrderId AND s.endTime IS NULL
      """)
  Optional<WorkSegment> findOpenByWorkOrderId(@Param("workOrderId") UUID workOrderId);
}
