package io.b2mash.crewhours.worksegment;

import io.b2mash.crewhours.exception.InvalidStateException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A crew working together over one interval. Hours are computed once, on close, as elapsed time
 * times {@code teamSize}; the member names are carried for readability only.
 *
 * <p>{@code openWorkOrderId} mirrors {@code workOrderId} while the segment is open and is cleared
 * on close. Its unique constraint allows at most one open segment per work order.
 */
@Entity
@Table(name = "work_segments")
public class WorkSegment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "work_order_id")
  private UUID workOrderId;

  @Column(name = "open_work_order_id", unique = true)
  private UUID openWorkOrderId;

  @Column(name = "start_time", nullable = false)
  private Instant startTime;

  @Column(name = "end_time")
  private Instant endTime;

  @Column(name = "team_size", nullable = false)
  private int teamSize;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "work_segment_members",
      joinColumns = @JoinColumn(name = "work_segment_id"))
  @OrderColumn(name = "member_order")
  @Column(name = "member_name", nullable = false)
  private List<String> teamMembers = new ArrayList<>();

  @Column(name = "total_hours", nullable = false)
  private double totalHours;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected WorkSegment() {}

  public WorkSegment(UUID workOrderId, Instant startTime, int teamSize, List<String> teamMembers) {
    this.workOrderId = workOrderId;
    this.openWorkOrderId = workOrderId;
    this.startTime = startTime;
    this.teamSize = teamSize;
    this.teamMembers = teamMembers != null ? new ArrayList<>(teamMembers) : new ArrayList<>();
    this.totalHours = 0.0;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void close(Instant endTime) {
    if (this.endTime != null) {
      throw new InvalidStateException(
          "Work segment closed", "Work segment " + id + " was already closed at " + this.endTime);
    }
    this.endTime = endTime;
    this.openWorkOrderId = null;
    this.totalHours = CrewHoursCalculator.teamHours(startTime, endTime, teamSize);
    this.updatedAt = Instant.now();
  }

  public boolean isActive() {
    return endTime == null;
  }

  /** True when {@code teamSize} or the member list differ from this segment's crew. */
  public boolean hasDifferentCrew(int teamSize, List<String> teamMembers) {
    List<String> members = teamMembers != null ? teamMembers : List.of();
    return this.teamSize != teamSize || !this.teamMembers.equals(members);
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkOrderId() {
    return workOrderId;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public int getTeamSize() {
    return teamSize;
  }

  public List<String> getTeamMembers() {
    return List.copyOf(teamMembers);
  }

  public double getTotalHours() {
    return totalHours;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int getVersion() {
    return version;
  }
}
